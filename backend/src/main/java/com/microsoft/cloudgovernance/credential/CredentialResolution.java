package com.microsoft.cloudgovernance.credential;

import com.microsoft.cloudgovernance.domain.model.CredentialPath;

/**
 * Which credential will be used for an environment, and why.
 *
 * @param credential the credential to use, or null when none could be obtained
 * @param delegated result of the delegated lookup, null when the environment has no client
 * @param platform result of the platform lookup, null when it was not attempted
 */
public record CredentialResolution(
        AccessCredential credential,
        TokenResult delegated,
        TokenResult platform
) {
    public boolean isResolved() {
        return credential != null;
    }

    public CredentialPath path() {
        return credential == null ? null : credential.path();
    }

    /**
     * True when the client's delegated token was unusable, whatever happened afterwards.
     */
    public boolean delegatedFailed() {
        return delegated != null && !delegated.isValid();
    }
}
