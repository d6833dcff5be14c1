package com.microsoft.cloudgovernance.credential;

public enum AccessStatus {
    NO_CREDENTIALS,
    CREDENTIALS_INVALID,
    INSUFFICIENT_PERMISSION,
    VALID,
    UNREACHABLE
}
