package com.microsoft.cloudgovernance.domain.model;

/**
 * Which credential an assessment actually used.
 */
public enum CredentialPath {
    /** Client's delegated OAuth token. */
    DELEGATED_OAUTH,
    /** Platform identity, the environment has no client. */
    PLATFORM_DEFAULT,
    /** Platform identity after the delegated token could not be used. */
    PLATFORM_FALLBACK
}
