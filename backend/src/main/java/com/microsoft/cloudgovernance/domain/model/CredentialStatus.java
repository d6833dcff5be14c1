package com.microsoft.cloudgovernance.domain.model;

/**
 * Health of a stored delegated credential.
 */
public enum CredentialStatus {
    VALID,
    INVALID,
    UNKNOWN
}
