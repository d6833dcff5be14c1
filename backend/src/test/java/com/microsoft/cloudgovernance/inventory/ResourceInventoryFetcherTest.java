package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient.ResourceGraphPage;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException.ErrorKind;
import com.microsoft.cloudgovernance.credential.AccessCredential;
import com.microsoft.cloudgovernance.credential.PlatformCredentialProvider;
import com.microsoft.cloudgovernance.credential.TokenResult;
import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResourceInventoryFetcherTest {

    private static final AccessCredential CREDENTIAL = new AccessCredential(
            "token", Instant.parse("2026-01-01T00:00:00Z"), CredentialPath.DELEGATED_OAUTH);

    @Mock
    private ResourceGraphClient resourceGraphClient;

    @Mock
    private PlatformCredentialProvider platformCredentialProvider;

    private ResourceInventoryFetcher fetcher;

    @BeforeEach
    void setUp() {
        RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 0.0,
                d -> { }, () -> 0.5);
        fetcher = new ResourceInventoryFetcher(resourceGraphClient, retryPolicy, Runnable::run, platformCredentialProvider);
    }

    private static ResourceSnapshot resource(String subscriptionId, String name) {
        return new ResourceSnapshot(
                "/subscriptions/" + subscriptionId + "/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/" + name,
                name, "Microsoft.Compute/virtualMachines", "rg", "eastus", subscriptionId,
                Map.of("Environment", "prod"), null, null);
    }

    @Nested
    @DisplayName("Fetching inventory")
    class FetchTests {

        @Test
        @DisplayName("Should follow skip tokens until the last page")
        void shouldPaginate() {
            // Given
            when(resourceGraphClient.query(eq(List.of("sub-1")), anyString(), isNull(), anyInt(), eq(CREDENTIAL)))
                    .thenReturn(new ResourceGraphPage(List.of(resource("sub-1", "vm-a")), "t1", 2));
            when(resourceGraphClient.query(eq(List.of("sub-1")), anyString(), eq("t1"), anyInt(), eq(CREDENTIAL)))
                    .thenReturn(new ResourceGraphPage(List.of(resource("sub-1", "vm-b")), null, 2));

            // When
            InventoryFetchResult result = fetcher.fetchResources(List.of("sub-1"), CREDENTIAL, new CancellationSignal());

            // Then
            assertThat(result.resources()).extracting(ResourceSnapshot::name).containsExactly("vm-a", "vm-b");
            assertThat(result.succeededSubscriptions()).containsExactly("sub-1");
            assertThat(result.hasFailures()).isFalse();
        }

        @Test
        @DisplayName("Should keep resources from healthy subscriptions when one fails")
        void shouldReportPartialFailure() {
            // Given
            when(resourceGraphClient.query(eq(List.of("sub-1")), anyString(), any(), anyInt(), any()))
                    .thenReturn(new ResourceGraphPage(List.of(resource("sub-1", "vm-a")), null, 1));
            when(resourceGraphClient.query(eq(List.of("sub-2")), anyString(), any(), anyInt(), any()))
                    .thenThrow(new ResourceGraphException(ErrorKind.FORBIDDEN, "Authorization failed"));

            // When
            InventoryFetchResult result = fetcher.fetchResources(
                    List.of("sub-1", "sub-2"), CREDENTIAL, new CancellationSignal());

            // Then
            assertThat(result.resources()).hasSize(1);
            assertThat(result.succeededSubscriptions()).containsExactly("sub-1");
            assertThat(result.allFailed()).isFalse();
            assertThat(result.failureSummary()).isEqualTo("sub-2:FORBIDDEN");
            assertThat(result.anyAuthorizationFailure()).isTrue();
        }

        @Test
        @DisplayName("Should retry throttled pages before giving up on a subscription")
        void shouldRetryThrottledPages() {
            when(resourceGraphClient.query(anyList(), anyString(), any(), anyInt(), any()))
                    .thenThrow(new ResourceGraphException(ErrorKind.THROTTLED, "429"))
                    .thenReturn(new ResourceGraphPage(List.of(resource("sub-1", "vm-a")), null, 1));

            InventoryFetchResult result = fetcher.fetchResources(List.of("sub-1"), CREDENTIAL, new CancellationSignal());

            assertThat(result.resources()).hasSize(1);
            verify(resourceGraphClient, times(2)).query(anyList(), anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Should query each subscription once regardless of case or blanks")
        void shouldDeduplicateSubscriptions() {
            when(resourceGraphClient.query(anyList(), anyString(), any(), anyInt(), any()))
                    .thenReturn(new ResourceGraphPage(List.of(), null, 0));

            InventoryFetchResult result = fetcher.fetchResources(
                    List.of("SUB-1", "sub-1", " ", "sub-2"), CREDENTIAL, new CancellationSignal());

            assertThat(result.succeededSubscriptions()).containsExactly("SUB-1", "sub-2");
            verify(resourceGraphClient, times(2)).query(anyList(), anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Should report every subscription as failed when all are denied")
        void shouldReportAllFailed() {
            when(resourceGraphClient.query(anyList(), anyString(), any(), anyInt(), any()))
                    .thenThrow(new ResourceGraphException(ErrorKind.UNAUTHORIZED, "401"));

            InventoryFetchResult result = fetcher.fetchResources(
                    List.of("sub-1", "sub-2"), CREDENTIAL, new CancellationSignal());

            assertThat(result.allFailed()).isTrue();
            assertThat(result.allFailuresAreAuthorization()).isTrue();
        }

        @Test
        @DisplayName("Should throw when the signal is cancelled")
        void shouldHonourCancellation() {
            CancellationSignal signal = new CancellationSignal();
            signal.cancel();

            assertThatThrownBy(() -> fetcher.fetchResources(List.of("sub-1"), CREDENTIAL, signal))
                    .isInstanceOf(CancellationException.class);
            verifyNoInteractions(resourceGraphClient);
        }
    }

    @Nested
    @DisplayName("Connection test")
    class ConnectionTests {

        @Test
        @DisplayName("Should succeed when a single-row query works")
        void shouldSucceed() {
            when(resourceGraphClient.query(anyList(), anyString(), isNull(), eq(1), eq(CREDENTIAL)))
                    .thenReturn(new ResourceGraphPage(List.of(), null, 0));

            assertThat(fetcher.testConnection(List.of("sub-1"), CREDENTIAL)).isTrue();
        }

        @Test
        @DisplayName("Should fail without querying when the platform identity is unavailable")
        void shouldFailWithoutPlatformCredential() {
            when(platformCredentialProvider.acquire()).thenReturn(TokenResult.unavailable("down"));

            assertThat(fetcher.testConnection(List.of("sub-1"), null)).isFalse();
            verifyNoInteractions(resourceGraphClient);
        }

        @Test
        @DisplayName("Should fail when Resource Graph rejects the credential")
        void shouldFailOnRejection() {
            when(resourceGraphClient.query(anyList(), anyString(), any(), anyInt(), any()))
                    .thenThrow(new ResourceGraphException(ErrorKind.FORBIDDEN, "403"));

            assertThat(fetcher.testConnection(List.of("sub-1"), CREDENTIAL)).isFalse();
        }
    }
}
