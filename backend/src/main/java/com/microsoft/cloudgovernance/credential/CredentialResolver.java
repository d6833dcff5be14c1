package com.microsoft.cloudgovernance.credential;

import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Chooses the credential for an environment.
 *
 * DECISION FLOW:
 * 1. Environment has a client -> delegated OAuth token from the vault
 * 2. Delegated token unusable and fallback enabled -> platform identity (PLATFORM_FALLBACK)
 * 3. No client -> platform identity (PLATFORM_DEFAULT)
 */
@Component
@Slf4j
public class CredentialResolver {

    private final CredentialVault credentialVault;
    private final PlatformCredentialProvider platformCredentialProvider;
    private final boolean platformFallbackEnabled;

    public CredentialResolver(
            CredentialVault credentialVault,
            PlatformCredentialProvider platformCredentialProvider,
            @Value("${compass.credentials.platform-fallback-enabled:true}") boolean platformFallbackEnabled
    ) {
        this.credentialVault = credentialVault;
        this.platformCredentialProvider = platformCredentialProvider;
        this.platformFallbackEnabled = platformFallbackEnabled;
    }

    public CredentialResolution resolve(UUID organizationId, UUID clientId) {
        if (clientId == null) {
            TokenResult platform = platformCredentialProvider.acquire();
            return new CredentialResolution(
                    platform.isValid() ? platform.credential().withPath(CredentialPath.PLATFORM_DEFAULT) : null,
                    null,
                    platform);
        }

        TokenResult delegated = credentialVault.getToken(clientId, organizationId);
        if (delegated.isValid()) {
            return new CredentialResolution(delegated.credential(), delegated, null);
        }

        log.warn("Delegated credential for client: {} is {}; {}", clientId, delegated.status(),
                platformFallbackEnabled ? "falling back to platform identity" : "fallback disabled");
        if (!platformFallbackEnabled) {
            return new CredentialResolution(null, delegated, null);
        }
        return fallback(delegated);
    }

    /**
     * Platform identity after a delegated credential proved unusable.
     */
    public CredentialResolution fallback(TokenResult delegated) {
        if (!platformFallbackEnabled) {
            return new CredentialResolution(null, delegated, null);
        }
        TokenResult platform = platformCredentialProvider.acquire();
        return new CredentialResolution(
                platform.isValid() ? platform.credential().withPath(CredentialPath.PLATFORM_FALLBACK) : null,
                delegated,
                platform);
    }
}
