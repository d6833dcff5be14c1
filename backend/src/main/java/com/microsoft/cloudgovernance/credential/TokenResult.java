package com.microsoft.cloudgovernance.credential;

/**
 * Outcome of a token request. Carries either a credential or a remediation hint.
 */
public record TokenResult(TokenStatus status, AccessCredential credential, String remediation) {

    public static TokenResult valid(AccessCredential credential) {
        return new TokenResult(TokenStatus.VALID, credential, null);
    }

    public static TokenResult notConfigured(String remediation) {
        return new TokenResult(TokenStatus.NOT_CONFIGURED, null, remediation);
    }

    public static TokenResult invalid(String remediation) {
        return new TokenResult(TokenStatus.INVALID, null, remediation);
    }

    public static TokenResult unavailable(String remediation) {
        return new TokenResult(TokenStatus.UNAVAILABLE, null, remediation);
    }

    public boolean isValid() {
        return status == TokenStatus.VALID && credential != null;
    }
}
