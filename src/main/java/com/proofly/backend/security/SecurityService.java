package com.proofly.backend.security;

import java.util.UUID;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component("securityService")
public class SecurityService {

    public GatewayPrincipal currentPrincipal() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || !(auth.getPrincipal() instanceof GatewayPrincipal principal)) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        return principal;
    }

    public UUID currentUserId() {
        return currentPrincipal().userId();
    }

    public boolean isAdmin() {
        return currentPrincipal().isAdmin();
    }
}
