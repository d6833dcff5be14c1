package com.microsoft.cloudgovernance.adapters;

/**
 * Port to the OAuth token endpoint of the identity provider.
 */
public interface IdentityProviderClient {

    /**
     * Exchange a refresh token for a new access token.
     *
     * @throws IdentityProviderException classified as AUTHORIZATION when the grant
     *         is rejected, UNAVAILABLE or TIMEOUT when the provider cannot be reached
     */
    TokenResponse refresh(String refreshToken);

    record TokenResponse(
            String accessToken,
            String refreshToken,
            long expiresInSeconds,
            String scope
    ) {
        @Override
        public String toString() {
            return "TokenResponse[expiresIn=" + expiresInSeconds + ", scope=" + scope + "]";
        }
    }
}
