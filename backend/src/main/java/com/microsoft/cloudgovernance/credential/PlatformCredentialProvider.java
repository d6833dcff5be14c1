package com.microsoft.cloudgovernance.credential;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.CredentialUnavailableException;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The platform's own Azure identity.
 *
 * CREDENTIAL STRATEGY:
 * Uses DefaultAzureCredential which tries multiple authentication methods:
 * 1. Environment variables (AZURE_CLIENT_ID, AZURE_CLIENT_SECRET, AZURE_TENANT_ID)
 * 2. Managed Identity (when running on Azure)
 * 3. Azure CLI credentials (for local development)
 *
 * Used directly for environments without a client, and as the fallback
 * when a client's delegated token cannot be used.
 */
@Component
@Slf4j
public class PlatformCredentialProvider {

    private static final String ARM_SCOPE = "https://management.azure.com/.default";

    private final TokenCredential credential;
    private final Clock clock;
    private final AtomicReference<AccessCredential> cached = new AtomicReference<>();

    @Value("${compass.credentials.platform-timeout:30s}")
    private Duration acquireTimeout = Duration.ofSeconds(30);

    @Value("${compass.credentials.refresh-margin:5m}")
    private Duration refreshMargin = Duration.ofMinutes(5);

    @Autowired
    public PlatformCredentialProvider(Clock clock) {
        this(new DefaultAzureCredentialBuilder().build(), clock);
        log.info("Platform credential initialized with DefaultAzureCredential");
    }

    PlatformCredentialProvider(TokenCredential credential, Clock clock) {
        this.credential = credential;
        this.clock = clock;
    }

    /**
     * Acquire an ARM token for the platform identity.
     */
    public TokenResult acquire() {
        AccessCredential current = cached.get();
        if (current != null && !current.expiresWithin(clock.instant(), refreshMargin)) {
            return TokenResult.valid(current);
        }

        try {
            AccessToken token = credential
                    .getToken(new TokenRequestContext().addScopes(ARM_SCOPE))
                    .block(acquireTimeout);
            if (token == null) {
                return TokenResult.unavailable("Platform identity returned no token; retry later");
            }
            AccessCredential acquired = new AccessCredential(
                    token.getToken(),
                    token.getExpiresAt().toInstant(),
                    CredentialPath.PLATFORM_DEFAULT
            );
            cached.set(acquired);
            return TokenResult.valid(acquired);

        } catch (CredentialUnavailableException e) {
            log.warn("Platform credential not configured: {}", e.getMessage());
            return TokenResult.notConfigured("Configure a managed identity or service principal for the platform");
        } catch (RuntimeException e) {
            log.error("Platform credential acquisition failed", e);
            return TokenResult.unavailable("Platform identity unavailable: " + e.getMessage());
        }
    }
}
