package com.microsoft.cloudgovernance.credential;

import com.microsoft.cloudgovernance.adapters.IdentityProviderClient;
import com.microsoft.cloudgovernance.adapters.IdentityProviderClient.TokenResponse;
import com.microsoft.cloudgovernance.adapters.IdentityProviderException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient.SubscriptionInfo;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import com.microsoft.cloudgovernance.domain.model.CredentialRecord;
import com.microsoft.cloudgovernance.domain.model.CredentialStatus;
import com.microsoft.cloudgovernance.domain.repository.CredentialRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delegated OAuth credentials per (client, organization).
 *
 * REFRESH STRATEGY:
 * - A token is reused while it expires more than the refresh margin from now
 * - At most one refresh runs per key; concurrent callers wait on the same future
 * - The refreshed token is cached and persisted before the future completes,
 *   so a caller arriving after completion sees the new token and never refreshes again
 * - Unrelated keys never wait on each other
 * - Waiters give up only after the identity provider's own timeouts have elapsed,
 *   so a slow refresh that succeeds is shared rather than reported as unavailable
 *
 * REVOCATION:
 * Each key carries a revision bumped by revokeCredentials. A refresh that started
 * before the revoke discards its result instead of persisting or caching it.
 *
 * FAILURE CLASSIFICATION:
 * NOT_CONFIGURED (no record), INVALID (grant rejected) and UNAVAILABLE
 * (provider down or slow) each carry their own remediation hint.
 */
@Service
@Slf4j
public class CredentialVault {

    private final CredentialRecordRepository credentialRepository;
    private final IdentityProviderClient identityProvider;
    private final ResourceGraphClient resourceGraphClient;
    private final Clock clock;
    private final Duration refreshMargin;
    private final Duration refreshWaitTimeout;

    private final Map<CredentialKey, AccessCredential> tokenCache = new ConcurrentHashMap<>();
    private final Map<CredentialKey, CompletableFuture<TokenResult>> inFlightRefreshes = new ConcurrentHashMap<>();
    private final Map<CredentialKey, AtomicLong> revisions = new ConcurrentHashMap<>();

    public CredentialVault(
            CredentialRecordRepository credentialRepository,
            IdentityProviderClient identityProvider,
            ResourceGraphClient resourceGraphClient,
            Clock clock,
            @Value("${compass.credentials.refresh-margin:5m}") Duration refreshMargin,
            @Value("${compass.credentials.refresh-wait-timeout:45s}") Duration refreshWaitTimeout,
            @Value("${compass.oauth.connect-timeout:5s}") Duration identityConnectTimeout,
            @Value("${compass.oauth.read-timeout:20s}") Duration identityReadTimeout
    ) {
        Duration longestRefresh = identityConnectTimeout.plus(identityReadTimeout);
        if (refreshWaitTimeout.compareTo(longestRefresh) <= 0) {
            throw new IllegalStateException("compass.credentials.refresh-wait-timeout (" + refreshWaitTimeout
                    + ") must exceed the identity provider connect + read timeout (" + longestRefresh + ")");
        }
        this.credentialRepository = credentialRepository;
        this.identityProvider = identityProvider;
        this.resourceGraphClient = resourceGraphClient;
        this.clock = clock;
        this.refreshMargin = refreshMargin;
        this.refreshWaitTimeout = refreshWaitTimeout;
    }

    /**
     * Return a usable delegated token, refreshing it if needed.
     */
    public TokenResult getToken(UUID clientId, UUID organizationId) {
        CredentialKey key = new CredentialKey(clientId, organizationId);

        AccessCredential cached = tokenCache.get(key);
        if (isUsable(cached)) {
            return TokenResult.valid(cached);
        }

        CompletableFuture<TokenResult> ours = new CompletableFuture<>();
        CompletableFuture<TokenResult> existing = inFlightRefreshes.putIfAbsent(key, ours);
        if (existing != null) {
            log.debug("Joining in-flight token refresh for client: {}", clientId);
            return await(existing, clientId);
        }

        try {
            TokenResult result = loadOrRefresh(key);
            ours.complete(result);
            return result;
        } catch (RuntimeException e) {
            log.error("Token lookup failed for client: {} in organization: {}", clientId, organizationId, e);
            TokenResult result = TokenResult.unavailable("Credential store unavailable; retry later");
            ours.complete(result);
            return result;
        } finally {
            inFlightRefreshes.remove(key, ours);
        }
    }

    /**
     * Probe whether the client's credential can read the given subscription.
     */
    public AccessCheck testAccess(UUID clientId, UUID organizationId, String subscriptionId) {
        TokenResult token = getToken(clientId, organizationId);
        if (!token.isValid()) {
            AccessStatus status = switch (token.status()) {
                case NOT_CONFIGURED -> AccessStatus.NO_CREDENTIALS;
                case INVALID -> AccessStatus.CREDENTIALS_INVALID;
                default -> AccessStatus.UNREACHABLE;
            };
            return new AccessCheck(status, token.remediation());
        }

        try {
            SubscriptionInfo subscription = resourceGraphClient.getSubscription(subscriptionId, token.credential());
            log.info("Access verified for client: {} on subscription: {}", clientId, subscriptionId);
            return new AccessCheck(AccessStatus.VALID,
                    "Access to subscription " + (subscription.displayName() != null
                            ? subscription.displayName() : subscriptionId) + " verified");
        } catch (ResourceGraphException e) {
            return switch (e.getKind()) {
                case UNAUTHORIZED -> new AccessCheck(AccessStatus.CREDENTIALS_INVALID,
                        "Token rejected by Azure Resource Manager; re-authenticate the client");
                case FORBIDDEN, NOT_FOUND -> new AccessCheck(AccessStatus.INSUFFICIENT_PERMISSION,
                        "Grant the Reader role on subscription " + subscriptionId);
                default -> new AccessCheck(AccessStatus.UNREACHABLE,
                        "Azure Resource Manager unreachable: " + e.getMessage());
            };
        }
    }

    /**
     * Store tokens obtained from a completed consent flow.
     */
    public void storeCredentials(UUID clientId, UUID organizationId, TokenResponse tokens) {
        CredentialKey key = new CredentialKey(clientId, organizationId);
        CredentialRecord record = credentialRepository.findByClientIdAndOrganizationId(clientId, organizationId)
                .orElseGet(() -> CredentialRecord.builder()
                        .clientId(clientId)
                        .organizationId(organizationId)
                        .build());
        AccessCredential credential = apply(record, tokens);
        synchronized (revisionOf(key)) {
            credentialRepository.save(record);
            tokenCache.put(key, credential);
        }
        log.info("Stored delegated credentials for client: {} in organization: {}", clientId, organizationId);
    }

    /**
     * Forget the client's delegated credentials. A refresh still running for the
     * same key finishes without writing anything back.
     */
    public void revokeCredentials(UUID clientId, UUID organizationId) {
        CredentialKey key = new CredentialKey(clientId, organizationId);
        AtomicLong revision = revisionOf(key);
        synchronized (revision) {
            revision.incrementAndGet();
            tokenCache.remove(key);
            credentialRepository.deleteByClientIdAndOrganizationId(clientId, organizationId);
        }
        log.info("Revoked delegated credentials for client: {} in organization: {}", clientId, organizationId);
    }

    private TokenResult loadOrRefresh(CredentialKey key) {
        // A refresh may have completed between the cache check and winning the slot
        AccessCredential cached = tokenCache.get(key);
        if (isUsable(cached)) {
            return TokenResult.valid(cached);
        }

        AtomicLong revision = revisionOf(key);
        long seenRevision = revision.get();
        Optional<CredentialRecord> maybeRecord =
                credentialRepository.findByClientIdAndOrganizationId(key.clientId(), key.organizationId());
        if (maybeRecord.isEmpty()) {
            return TokenResult.notConfigured("Client has not granted access; complete the Azure consent flow");
        }
        CredentialRecord record = maybeRecord.get();

        if (record.getAccessToken() != null && record.getExpiresAt() != null
                && record.getExpiresAt().isAfter(clock.instant().plus(refreshMargin))) {
            AccessCredential stored = new AccessCredential(
                    record.getAccessToken(), record.getExpiresAt(), CredentialPath.DELEGATED_OAUTH);
            if (!writeBack(key, revision, seenRevision, null, stored)) {
                return revokedDuringLookup(key);
            }
            return TokenResult.valid(stored);
        }

        if (record.getRefreshToken() == null || record.getRefreshToken().isBlank()) {
            return TokenResult.invalid("Stored credential cannot be refreshed; re-authenticate the client");
        }

        log.info("Refreshing delegated token for client: {} in organization: {}",
                key.clientId(), key.organizationId());
        try {
            TokenResponse response = identityProvider.refresh(record.getRefreshToken());
            AccessCredential refreshed = apply(record, response);
            if (!writeBack(key, revision, seenRevision, record, refreshed)) {
                return revokedDuringLookup(key);
            }
            return TokenResult.valid(refreshed);

        } catch (IdentityProviderException e) {
            tokenCache.remove(key);
            record.setLastRefreshError(e.getMessage());
            if (e.getKind() == IdentityProviderException.ErrorKind.AUTHORIZATION) {
                record.setStatus(CredentialStatus.INVALID);
                if (!writeBack(key, revision, seenRevision, record, null)) {
                    return revokedDuringLookup(key);
                }
                log.warn("Delegated credential rejected for client: {}: {}", key.clientId(), e.getMessage());
                return TokenResult.invalid("Refresh token was rejected; re-authenticate the client");
            }
            if (!writeBack(key, revision, seenRevision, record, null)) {
                return revokedDuringLookup(key);
            }
            log.warn("Identity provider unavailable while refreshing client: {}: {}", key.clientId(), e.getMessage());
            return TokenResult.unavailable("Identity provider unavailable; retry later");
        }
    }

    /**
     * Persist the record and cache the credential unless the key was revoked since
     * {@code seenRevision} was read. Either argument may be null.
     *
     * @return false if the key was revoked and nothing was written
     */
    private boolean writeBack(CredentialKey key, AtomicLong revision, long seenRevision,
                              CredentialRecord record, AccessCredential credential) {
        synchronized (revision) {
            if (revision.get() != seenRevision) {
                return false;
            }
            if (record != null) {
                credentialRepository.save(record);
            }
            if (credential != null) {
                tokenCache.put(key, credential);
            }
            return true;
        }
    }

    private TokenResult revokedDuringLookup(CredentialKey key) {
        log.info("Credentials for client: {} were revoked during token lookup; discarding result", key.clientId());
        return TokenResult.notConfigured("Client access was revoked; complete the Azure consent flow");
    }

    private AtomicLong revisionOf(CredentialKey key) {
        return revisions.computeIfAbsent(key, k -> new AtomicLong());
    }

    private AccessCredential apply(CredentialRecord record, TokenResponse response) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(response.expiresInSeconds());
        record.setAccessToken(response.accessToken());
        if (response.refreshToken() != null) {
            record.setRefreshToken(response.refreshToken());
        }
        record.setExpiresAt(expiresAt);
        record.setScopes(response.scope());
        record.setLastRefreshedAt(now);
        record.setLastRefreshError(null);
        record.setStatus(CredentialStatus.VALID);
        return new AccessCredential(response.accessToken(), expiresAt, CredentialPath.DELEGATED_OAUTH);
    }

    private boolean isUsable(AccessCredential credential) {
        return credential != null && !credential.expiresWithin(clock.instant(), refreshMargin);
    }

    private TokenResult await(CompletableFuture<TokenResult> refresh, UUID clientId) {
        try {
            return refresh.get(refreshWaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TokenResult.unavailable("Interrupted while waiting for token refresh");
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for token refresh for client: {}", clientId);
            return TokenResult.unavailable("Token refresh is taking too long; retry later");
        } catch (ExecutionException e) {
            log.error("Token refresh failed for client: {}", clientId, e.getCause());
            return TokenResult.unavailable("Token refresh failed; retry later");
        }
    }

    private record CredentialKey(UUID clientId, UUID organizationId) {}
}
