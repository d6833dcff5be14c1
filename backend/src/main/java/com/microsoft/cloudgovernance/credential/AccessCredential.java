package com.microsoft.cloudgovernance.credential;

import com.microsoft.cloudgovernance.domain.model.CredentialPath;

import java.time.Instant;

/**
 * Bearer token for Azure Resource Manager plus the path it was obtained through.
 */
public record AccessCredential(String accessToken, Instant expiresAt, CredentialPath path) {

    public AccessCredential withPath(CredentialPath newPath) {
        return new AccessCredential(accessToken, expiresAt, newPath);
    }

    public boolean expiresWithin(Instant now, java.time.Duration margin) {
        return expiresAt == null || !expiresAt.isAfter(now.plus(margin));
    }

    @Override
    public String toString() {
        return "AccessCredential[path=" + path + ", expiresAt=" + expiresAt + "]";
    }
}
