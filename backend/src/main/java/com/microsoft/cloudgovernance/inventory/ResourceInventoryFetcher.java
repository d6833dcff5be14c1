package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient.ResourceGraphPage;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import com.microsoft.cloudgovernance.credential.AccessCredential;
import com.microsoft.cloudgovernance.credential.PlatformCredentialProvider;
import com.microsoft.cloudgovernance.credential.TokenResult;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Pulls resource inventory from Azure Resource Graph.
 *
 * FETCH STRATEGY:
 * - One task per subscription on a bounded worker pool
 * - Each task pages with $skipToken until exhausted or the page cap is hit
 * - Transient failures are retried by the RetryPolicy; a subscription that
 *   still fails is reported in the result, the others still count
 * - The call returns only after every subscription task has finished
 *
 * Results keep the order of the requested subscriptions.
 */
@Service
@Slf4j
public class ResourceInventoryFetcher {

    static final String INVENTORY_QUERY = "Resources " +
            "| where type !~ 'microsoft.resources/deployments' " +
            "| where type !~ 'microsoft.resources/deploymentscripts' " +
            "| project id, name, type, resourceGroup, location, subscriptionId, tags, kind, sku " +
            "| order by id asc";

    static final String CONNECTION_TEST_QUERY = "Resources | limit 1 | project id, name, type";

    private final ResourceGraphClient resourceGraphClient;
    private final RetryPolicy retryPolicy;
    private final Executor fetchExecutor;
    private final PlatformCredentialProvider platformCredentialProvider;

    @Value("${compass.inventory.page-size:1000}")
    private int pageSize = 1000;

    @Value("${compass.inventory.max-pages:100}")
    private int maxPages = 100;

    public ResourceInventoryFetcher(
            ResourceGraphClient resourceGraphClient,
            RetryPolicy retryPolicy,
            @Qualifier("inventoryFetchExecutor") Executor fetchExecutor,
            PlatformCredentialProvider platformCredentialProvider
    ) {
        this.resourceGraphClient = resourceGraphClient;
        this.retryPolicy = retryPolicy;
        this.fetchExecutor = fetchExecutor;
        this.platformCredentialProvider = platformCredentialProvider;
    }

    /**
     * Fetch every resource in the given subscriptions.
     *
     * @throws CancellationException if the signal fired while fetching
     */
    public InventoryFetchResult fetchResources(
            List<String> subscriptionIds,
            AccessCredential credential,
            CancellationSignal signal
    ) {
        List<String> distinct = distinctIgnoreCase(subscriptionIds);
        log.info("Fetching inventory for {} subscriptions via {}", distinct.size(), credential.path());

        Map<String, CompletableFuture<SubscriptionOutcome>> tasks = new LinkedHashMap<>();
        for (String subscriptionId : distinct) {
            tasks.put(subscriptionId, CompletableFuture.supplyAsync(
                    () -> fetchSubscription(subscriptionId, credential, signal), fetchExecutor));
        }
        CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0])).join();
        signal.throwIfCancelled();

        List<ResourceSnapshot> resources = new ArrayList<>();
        List<String> succeeded = new ArrayList<>();
        List<SubscriptionFailure> failures = new ArrayList<>();

        for (var entry : tasks.entrySet()) {
            SubscriptionOutcome outcome = entry.getValue().join();
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                succeeded.add(entry.getKey());
                resources.addAll(outcome.resources());
            }
        }

        log.info("Inventory fetch complete: {} resources, {} subscriptions succeeded, {} failed",
                resources.size(), succeeded.size(), failures.size());
        return new InventoryFetchResult(resources, succeeded, failures);
    }

    /**
     * Check that the credential can query the subscriptions. Has no side effects.
     *
     * @param credential credential to test, or null to use the platform identity
     */
    public boolean testConnection(List<String> subscriptionIds, AccessCredential credential) {
        AccessCredential effective = credential;
        if (effective == null) {
            TokenResult platform = platformCredentialProvider.acquire();
            if (!platform.isValid()) {
                log.warn("Connection test skipped: platform credential is {}", platform.status());
                return false;
            }
            effective = platform.credential();
        }

        try {
            resourceGraphClient.query(distinctIgnoreCase(subscriptionIds), CONNECTION_TEST_QUERY, null, 1, effective);
            log.info("Connection test succeeded for subscriptions: {}", subscriptionIds);
            return true;
        } catch (ResourceGraphException e) {
            log.warn("Connection test failed for subscriptions: {} ({}): {}",
                    subscriptionIds, e.getKind(), e.getMessage());
            return false;
        }
    }

    private SubscriptionOutcome fetchSubscription(String subscriptionId, AccessCredential credential,
                                                  CancellationSignal signal) {
        List<ResourceSnapshot> resources = new ArrayList<>();
        String skipToken = null;
        int pages = 0;

        try {
            do {
                signal.throwIfCancelled();
                final String token = skipToken;
                ResourceGraphPage page = retryPolicy.execute(
                        "Resource Graph page " + (pages + 1) + " for subscription " + subscriptionId,
                        signal,
                        () -> resourceGraphClient.query(List.of(subscriptionId), INVENTORY_QUERY, token, pageSize, credential)
                );
                resources.addAll(page.resources());
                skipToken = page.hasMore() ? page.skipToken() : null;
                pages++;
            } while (skipToken != null && pages < maxPages);

            if (skipToken != null) {
                log.warn("Subscription {} truncated at {} pages ({} resources)", subscriptionId, maxPages, resources.size());
            }
            log.debug("Subscription {} returned {} resources in {} pages", subscriptionId, resources.size(), pages);
            return new SubscriptionOutcome(resources, null);

        } catch (ResourceGraphException e) {
            log.warn("Inventory fetch failed for subscription {} ({}): {}", subscriptionId, e.getKind(), e.getMessage());
            return new SubscriptionOutcome(List.of(), new SubscriptionFailure(subscriptionId, e.getKind(), e.getMessage()));
        } catch (CancellationException e) {
            return new SubscriptionOutcome(List.of(), new SubscriptionFailure(subscriptionId, null, "Cancelled"));
        } catch (RuntimeException e) {
            log.error("Unexpected error fetching subscription {}", subscriptionId, e);
            return new SubscriptionOutcome(List.of(), new SubscriptionFailure(subscriptionId, null, e.getMessage()));
        }
    }

    private static List<String> distinctIgnoreCase(List<String> subscriptionIds) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String id : subscriptionIds) {
            if (id != null && !id.isBlank()) {
                seen.putIfAbsent(id.trim().toLowerCase(Locale.ROOT), id.trim());
            }
        }
        return new ArrayList<>(seen.values());
    }

    private record SubscriptionOutcome(List<ResourceSnapshot> resources, SubscriptionFailure failure) {}
}
