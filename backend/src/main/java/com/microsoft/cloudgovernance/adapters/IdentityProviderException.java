package com.microsoft.cloudgovernance.adapters;

public class IdentityProviderException extends RuntimeException {

    public enum ErrorKind {
        /** Grant rejected. The user has to consent again. */
        AUTHORIZATION,
        /** Provider returned 5xx or could not be reached. */
        UNAVAILABLE,
        TIMEOUT
    }

    private final ErrorKind kind;

    public IdentityProviderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
