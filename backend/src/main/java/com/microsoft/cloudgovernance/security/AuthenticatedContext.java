package com.microsoft.cloudgovernance.security;

import java.util.Set;
import java.util.UUID;

/**
 * Caller identity, derived from the bearer token and passed explicitly into every
 * core operation. The core never falls back to a default identity.
 */
public record AuthenticatedContext(UUID organizationId, UUID customerId, Set<String> roles) {

    public AuthenticatedContext {
        if (organizationId == null || customerId == null) {
            throw new IllegalArgumentException("organizationId and customerId are required");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
