package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;

/**
 * Controllers pass the caller explicitly into the core; a request without an
 * authenticated caller never reaches it.
 */
final class Callers {

    private Callers() {
    }

    static AuthenticatedContext require(AuthenticatedContext context) {
        if (context == null) {
            throw new AuthenticationCredentialsNotFoundException("Bearer token required");
        }
        return context;
    }
}
