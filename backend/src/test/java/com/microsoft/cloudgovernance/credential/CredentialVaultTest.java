package com.microsoft.cloudgovernance.credential;

import com.microsoft.cloudgovernance.adapters.IdentityProviderClient;
import com.microsoft.cloudgovernance.adapters.IdentityProviderClient.TokenResponse;
import com.microsoft.cloudgovernance.adapters.IdentityProviderException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient.SubscriptionInfo;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException.ErrorKind;
import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import com.microsoft.cloudgovernance.domain.model.CredentialRecord;
import com.microsoft.cloudgovernance.domain.model.CredentialStatus;
import com.microsoft.cloudgovernance.domain.repository.CredentialRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialVaultTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID CLIENT_ID = UUID.randomUUID();
    private static final UUID ORG_ID = UUID.randomUUID();

    @Mock
    private CredentialRecordRepository credentialRepository;

    @Mock
    private IdentityProviderClient identityProvider;

    @Mock
    private ResourceGraphClient resourceGraphClient;

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = vaultWithTimeouts(Duration.ofSeconds(5), Duration.ofMillis(100), Duration.ofMillis(400));
    }

    private CredentialVault vaultWithTimeouts(Duration wait, Duration connect, Duration read) {
        return new CredentialVault(credentialRepository, identityProvider, resourceGraphClient,
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5), wait, connect, read);
    }

    private static CredentialRecord record(String accessToken, Instant expiresAt, String refreshToken) {
        return CredentialRecord.builder()
                .clientId(CLIENT_ID)
                .organizationId(ORG_ID)
                .accessToken(accessToken)
                .expiresAt(expiresAt)
                .refreshToken(refreshToken)
                .status(CredentialStatus.VALID)
                .build();
    }

    private void stored(CredentialRecord record) {
        when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID)).thenReturn(Optional.of(record));
    }

    @Nested
    @DisplayName("Token lookup")
    class LookupTests {

        @Test
        @DisplayName("Should report NOT_CONFIGURED when the client never granted access")
        void shouldReportNotConfigured() {
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID)).thenReturn(Optional.empty());

            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            assertThat(result.status()).isEqualTo(TokenStatus.NOT_CONFIGURED);
            assertThat(result.remediation()).contains("consent");
        }

        @Test
        @DisplayName("Should return a stored token that is outside the refresh margin")
        void shouldReturnStoredToken() {
            stored(record("stored-token", NOW.plus(Duration.ofHours(1)), "refresh"));

            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            assertThat(result.isValid()).isTrue();
            assertThat(result.credential().accessToken()).isEqualTo("stored-token");
            assertThat(result.credential().path()).isEqualTo(CredentialPath.DELEGATED_OAUTH);
            verifyNoInteractions(identityProvider);
        }

        @Test
        @DisplayName("Should refresh a token expiring inside the margin and serve later calls from cache")
        void shouldRefreshAndCache() {
            // Given
            CredentialRecord record = record("old-token", NOW.plus(Duration.ofMinutes(2)), "refresh");
            stored(record);
            when(identityProvider.refresh("refresh"))
                    .thenReturn(new TokenResponse("new-token", "rotated", 3600, "scope"));

            // When
            TokenResult first = vault.getToken(CLIENT_ID, ORG_ID);
            TokenResult second = vault.getToken(CLIENT_ID, ORG_ID);

            // Then
            assertThat(first.credential().accessToken()).isEqualTo("new-token");
            assertThat(first.credential().expiresAt()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(second.credential().accessToken()).isEqualTo("new-token");
            assertThat(record.getRefreshToken()).isEqualTo("rotated");
            assertThat(record.getLastRefreshedAt()).isEqualTo(NOW);
            verify(identityProvider, times(1)).refresh(anyString());
            verify(credentialRepository).save(record);
        }

        @Test
        @DisplayName("Should refresh a token exactly at the margin boundary")
        void shouldRefreshAtBoundary() {
            stored(record("old-token", NOW.plus(Duration.ofMinutes(5)), "refresh"));
            when(identityProvider.refresh("refresh"))
                    .thenReturn(new TokenResponse("new-token", null, 3600, "scope"));

            assertThat(vault.getToken(CLIENT_ID, ORG_ID).credential().accessToken()).isEqualTo("new-token");
        }

        @Test
        @DisplayName("Should mark the credential INVALID when the grant is rejected")
        void shouldMarkInvalidOnRejectedGrant() {
            // Given
            CredentialRecord record = record("old-token", NOW.minusSeconds(60), "revoked");
            stored(record);
            when(identityProvider.refresh("revoked")).thenThrow(new IdentityProviderException(
                    IdentityProviderException.ErrorKind.AUTHORIZATION, "invalid_grant", null));

            // When
            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            // Then
            assertThat(result.status()).isEqualTo(TokenStatus.INVALID);
            assertThat(record.getStatus()).isEqualTo(CredentialStatus.INVALID);
            assertThat(record.getLastRefreshError()).isEqualTo("invalid_grant");
        }

        @Test
        @DisplayName("Should report UNAVAILABLE without invalidating when the provider is down")
        void shouldReportUnavailable() {
            CredentialRecord record = record("old-token", NOW.minusSeconds(60), "refresh");
            stored(record);
            when(identityProvider.refresh("refresh")).thenThrow(new IdentityProviderException(
                    IdentityProviderException.ErrorKind.UNAVAILABLE, "503", null));

            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            assertThat(result.status()).isEqualTo(TokenStatus.UNAVAILABLE);
            assertThat(record.getStatus()).isEqualTo(CredentialStatus.VALID);
        }

        @Test
        @DisplayName("Should report INVALID when an expired token has no refresh token")
        void shouldReportInvalidWithoutRefreshToken() {
            stored(record("old-token", NOW.minusSeconds(60), null));

            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            assertThat(result.status()).isEqualTo(TokenStatus.INVALID);
            verifyNoInteractions(identityProvider);
        }

        @Test
        @DisplayName("Should report UNAVAILABLE when the credential store fails")
        void shouldReportUnavailableOnStoreFailure() {
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID))
                    .thenThrow(new IllegalStateException("connection refused"));

            assertThat(vault.getToken(CLIENT_ID, ORG_ID).status()).isEqualTo(TokenStatus.UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("Concurrent refresh")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should refresh once when many callers need the same expiring token")
        void shouldRefreshOnce() throws Exception {
            // Given
            stored(record("old-token", NOW.plus(Duration.ofMinutes(1)), "refresh"));
            CountDownLatch release = new CountDownLatch(1);
            when(identityProvider.refresh("refresh")).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return new TokenResponse("new-token", null, 3600, "scope");
            });

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                // When
                List<Future<TokenResult>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    results.add(pool.submit(() -> vault.getToken(CLIENT_ID, ORG_ID)));
                }
                Thread.sleep(200);
                release.countDown();

                // Then
                for (Future<TokenResult> result : results) {
                    TokenResult token = result.get(10, TimeUnit.SECONDS);
                    assertThat(token.isValid()).isTrue();
                    assertThat(token.credential().accessToken()).isEqualTo("new-token");
                }
                verify(identityProvider, times(1)).refresh(anyString());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should share a slow refresh that finishes within the identity provider timeouts")
        void shouldShareSlowRefresh() throws Exception {
            // Given
            vault = vaultWithTimeouts(Duration.ofSeconds(1), Duration.ofMillis(100), Duration.ofMillis(600));
            stored(record("old-token", NOW.plus(Duration.ofMinutes(1)), "refresh"));
            CountDownLatch entered = new CountDownLatch(1);
            when(identityProvider.refresh("refresh")).thenAnswer(invocation -> {
                entered.countDown();
                Thread.sleep(600);
                return new TokenResponse("slow-token", null, 3600, "scope");
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                // When
                Future<TokenResult> leader = pool.submit(() -> vault.getToken(CLIENT_ID, ORG_ID));
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
                Future<TokenResult> joiner = pool.submit(() -> vault.getToken(CLIENT_ID, ORG_ID));

                // Then
                assertThat(leader.get(5, TimeUnit.SECONDS).status()).isEqualTo(TokenStatus.VALID);
                TokenResult joined = joiner.get(5, TimeUnit.SECONDS);
                assertThat(joined.status()).isEqualTo(TokenStatus.VALID);
                assertThat(joined.credential().accessToken()).isEqualTo("slow-token");
                verify(identityProvider, times(1)).refresh(anyString());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should refuse a wait timeout that a refresh could outlast")
        void shouldRejectShortWaitTimeout() {
            assertThatThrownBy(() ->
                    vaultWithTimeouts(Duration.ofSeconds(45), Duration.ofSeconds(10), Duration.ofSeconds(60)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("refresh-wait-timeout");
        }
    }

    @Nested
    @DisplayName("Access test")
    class AccessTests {

        @Test
        @DisplayName("Should report VALID when the subscription can be read")
        void shouldReportValid() {
            stored(record("token", NOW.plus(Duration.ofHours(1)), "refresh"));
            when(resourceGraphClient.getSubscription(any(), any()))
                    .thenReturn(new SubscriptionInfo("sub-1", "Production", "Enabled"));

            AccessCheck check = vault.testAccess(CLIENT_ID, ORG_ID, "sub-1");

            assertThat(check.isValid()).isTrue();
            assertThat(check.message()).contains("Production");
        }

        @Test
        @DisplayName("Should report INSUFFICIENT_PERMISSION when the subscription is forbidden")
        void shouldReportInsufficientPermission() {
            stored(record("token", NOW.plus(Duration.ofHours(1)), "refresh"));
            when(resourceGraphClient.getSubscription(any(), any()))
                    .thenThrow(new ResourceGraphException(ErrorKind.FORBIDDEN, "403"));

            AccessCheck check = vault.testAccess(CLIENT_ID, ORG_ID, "sub-1");

            assertThat(check.status()).isEqualTo(AccessStatus.INSUFFICIENT_PERMISSION);
            assertThat(check.message()).contains("Reader");
        }

        @Test
        @DisplayName("Should report NO_CREDENTIALS without calling Azure")
        void shouldReportNoCredentials() {
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID)).thenReturn(Optional.empty());

            assertThat(vault.testAccess(CLIENT_ID, ORG_ID, "sub-1").status()).isEqualTo(AccessStatus.NO_CREDENTIALS);
            verifyNoInteractions(resourceGraphClient);
        }
    }

    @Nested
    @DisplayName("Storing and revoking")
    class LifecycleTests {

        @Test
        @DisplayName("Should create a record from a consent grant and serve it without a lookup")
        void shouldStoreNewCredentials() {
            // Given
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID)).thenReturn(Optional.empty());

            // When
            vault.storeCredentials(CLIENT_ID, ORG_ID, new TokenResponse("granted", "refresh-1", 3600, "scope"));
            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            // Then
            verify(credentialRepository).save(argThat(saved ->
                    saved.getClientId().equals(CLIENT_ID)
                            && "granted".equals(saved.getAccessToken())
                            && "refresh-1".equals(saved.getRefreshToken())
                            && saved.getStatus() == CredentialStatus.VALID));
            assertThat(result.credential().accessToken()).isEqualTo("granted");
            verify(credentialRepository, times(1)).findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID);
        }

        @Test
        @DisplayName("Should drop the cached token and delete the record on revoke")
        void shouldRevokeCredentials() {
            // Given
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID))
                    .thenReturn(Optional.empty());
            vault.storeCredentials(CLIENT_ID, ORG_ID, new TokenResponse("granted", "refresh-1", 3600, "scope"));

            // When
            vault.revokeCredentials(CLIENT_ID, ORG_ID);
            TokenResult result = vault.getToken(CLIENT_ID, ORG_ID);

            // Then
            verify(credentialRepository).deleteByClientIdAndOrganizationId(CLIENT_ID, ORG_ID);
            assertThat(result.status()).isEqualTo(TokenStatus.NOT_CONFIGURED);
        }

        @Test
        @DisplayName("Should not write back a refresh that was running when the credentials were revoked")
        void shouldDiscardRefreshFinishingAfterRevoke() throws Exception {
            // Given
            CredentialRecord record = record("old-token", NOW.plus(Duration.ofMinutes(1)), "refresh");
            when(credentialRepository.findByClientIdAndOrganizationId(CLIENT_ID, ORG_ID))
                    .thenReturn(Optional.of(record), Optional.empty());
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(identityProvider.refresh("refresh")).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return new TokenResponse("late-token", "rotated", 3600, "scope");
            });

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                // When
                Future<TokenResult> refreshing = pool.submit(() -> vault.getToken(CLIENT_ID, ORG_ID));
                assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
                vault.revokeCredentials(CLIENT_ID, ORG_ID);
                release.countDown();
                TokenResult result = refreshing.get(5, TimeUnit.SECONDS);

                // Then
                assertThat(result.status()).isEqualTo(TokenStatus.NOT_CONFIGURED);
                verify(credentialRepository, never()).save(any());
                assertThat(vault.getToken(CLIENT_ID, ORG_ID).status()).isEqualTo(TokenStatus.NOT_CONFIGURED);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
