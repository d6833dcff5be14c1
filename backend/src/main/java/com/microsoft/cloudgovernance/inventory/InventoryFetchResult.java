package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Combined inventory across subscriptions plus the subscriptions that failed.
 */
public record InventoryFetchResult(
        List<ResourceSnapshot> resources,
        List<String> succeededSubscriptions,
        List<SubscriptionFailure> failures
) {
    public InventoryFetchResult {
        resources = List.copyOf(resources);
        succeededSubscriptions = List.copyOf(succeededSubscriptions);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean allFailed() {
        return succeededSubscriptions.isEmpty() && !failures.isEmpty();
    }

    public boolean allFailuresAreAuthorization() {
        return hasFailures() && failures.stream().allMatch(SubscriptionFailure::isAuthorizationFailure);
    }

    public boolean anyAuthorizationFailure() {
        return failures.stream().anyMatch(SubscriptionFailure::isAuthorizationFailure);
    }

    /**
     * Failed subscriptions as "id:KIND" pairs, or null when none failed.
     */
    public String failureSummary() {
        if (failures.isEmpty()) {
            return null;
        }
        return failures.stream().map(SubscriptionFailure::summary).collect(Collectors.joining(","));
    }
}
