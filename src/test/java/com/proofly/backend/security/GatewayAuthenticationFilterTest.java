package com.proofly.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class GatewayAuthenticationFilterTest {

    private final GatewayAuthenticationFilter filter = new GatewayAuthenticationFilter();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void doFilter_validHeaders_authenticatesPrincipal() throws Exception {
        UUID userId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports");
        request.addHeader(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString());
        request.addHeader(GatewayAuthenticationFilter.ROLES_HEADER, "admin");
        request.addHeader(GatewayAuthenticationFilter.EMAIL_HEADER, "ana@example.com");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        GatewayPrincipal principal = (GatewayPrincipal) auth.getPrincipal();
        assertThat(principal.userId()).isEqualTo(userId);
        assertThat(principal.email()).isEqualTo("ana@example.com");
        assertThat(principal.isAdmin()).isTrue();
        assertThat(auth.getAuthorities()).extracting(Object::toString).contains("ROLE_USER", "ROLE_ADMIN");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void doFilter_noHeader_passesThroughAnonymous() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/public/verify/X"), new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void doFilter_malformedUserId_unauthorized() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports");
        request.addHeader(GatewayAuthenticationFilter.USER_ID_HEADER, "not-a-uuid");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("Invalid user id");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void parseRoles_alwaysUserAndNormalized() {
        assertThat(GatewayAuthenticationFilter.parseRoles(null)).containsExactly("USER");
        assertThat(GatewayAuthenticationFilter.parseRoles(" role_admin , reviewer,,"))
                .containsExactly("USER", "ADMIN", "REVIEWER");
    }
}
