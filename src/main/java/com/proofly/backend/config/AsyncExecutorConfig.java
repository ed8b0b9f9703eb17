package com.proofly.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "documentProcessingExecutor")
    public Executor documentProcessingExecutor() {
        return buildExecutor(2, 4, 200, "doc-processing-");
    }

    // AI calls are slow and rate limited upstream; keep the pool small.
    @Bean(name = "categorizationExecutor")
    public Executor categorizationExecutor() {
        return buildExecutor(2, 2, 100, "categorization-");
    }

    @Bean(name = "reportGenerationExecutor")
    public Executor reportGenerationExecutor() {
        return buildExecutor(1, 2, 100, "report-generation-");
    }

    private static Executor buildExecutor(int core, int max, int queue, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
