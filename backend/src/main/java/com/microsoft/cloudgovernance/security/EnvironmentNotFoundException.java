package com.microsoft.cloudgovernance.security;

import java.util.UUID;

/**
 * Environment is missing, inactive, or not visible to the caller's organization.
 * The cases are deliberately indistinguishable to the caller.
 */
public class EnvironmentNotFoundException extends RuntimeException {

    private final UUID environmentId;

    public EnvironmentNotFoundException(UUID environmentId) {
        super("Azure environment " + environmentId + " not found");
        this.environmentId = environmentId;
    }

    public UUID getEnvironmentId() {
        return environmentId;
    }
}
