package com.microsoft.cloudgovernance.adapters;

import java.time.Duration;

/**
 * Failure talking to Azure Resource Graph or Resource Manager.
 */
public class ResourceGraphException extends RuntimeException {

    public enum ErrorKind {
        THROTTLED(true),
        TRANSIENT(true),
        TIMEOUT(true),
        UNAUTHORIZED(false),
        FORBIDDEN(false),
        NOT_FOUND(false),
        BAD_REQUEST(false);

        private final boolean retryable;

        ErrorKind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }

        public boolean isAuthorizationFailure() {
            return this == UNAUTHORIZED || this == FORBIDDEN;
        }
    }

    private final ErrorKind kind;
    private final Integer statusCode;
    private final Duration retryAfter;

    public ResourceGraphException(ErrorKind kind, Integer statusCode, Duration retryAfter, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public ResourceGraphException(ErrorKind kind, String message) {
        this(kind, null, null, message, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Server-requested wait from a Retry-After header, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
