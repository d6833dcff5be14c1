package com.microsoft.cloudgovernance.domain.model;

/**
 * Machine-readable reason an assessment ended in FAILED.
 */
public enum FailureReason {
    CREDENTIAL_MISSING("CredentialMissing"),
    CREDENTIAL_INVALID("CredentialInvalid"),
    IDENTITY_PROVIDER_UNAVAILABLE("IdentityProviderUnavailable"),
    ENVIRONMENT_NOT_FOUND("EnvironmentNotFound"),
    INSUFFICIENT_PERMISSION("InsufficientPermission"),
    PROVIDER_UNAVAILABLE("ProviderUnavailable"),
    ANALYZER_ERROR("AnalyzerError"),
    PERSISTENCE_ERROR("PersistenceError"),
    CANCELLED("Cancelled"),
    INTERRUPTED("Interrupted"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
