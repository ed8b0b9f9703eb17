package com.proofly.backend.security;

import java.util.Set;
import java.util.UUID;

/**
 * Identity forwarded by the API gateway. The gateway authenticates the caller; this service only
 * trusts the forwarded headers.
 */
public record GatewayPrincipal(UUID userId, String email, String name, Set<String> roles) {

    public boolean isAdmin() {
        return roles.contains("ADMIN");
    }
}
