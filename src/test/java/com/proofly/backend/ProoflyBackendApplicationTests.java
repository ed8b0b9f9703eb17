package com.proofly.backend;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ProoflyBackendApplicationTests {

	@Test
	void contextLoads() {
	}

}
