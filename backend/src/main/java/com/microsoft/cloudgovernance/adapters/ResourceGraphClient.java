package com.microsoft.cloudgovernance.adapters;

import com.microsoft.cloudgovernance.credential.AccessCredential;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;

import java.util.List;

/**
 * Port to the Azure Resource Graph and Resource Manager APIs.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Translate every failure into a ResourceGraphException with an ErrorKind
 * 2. Never retry internally; retry policy belongs to the caller
 * 3. Honour connect and read timeouts
 */
public interface ResourceGraphClient {

    /**
     * Run one page of a Resource Graph query.
     *
     * @param subscriptionIds subscriptions the query is scoped to
     * @param query KQL query text
     * @param skipToken continuation token from the previous page, or null
     * @param pageSize max rows to return
     */
    ResourceGraphPage query(
            List<String> subscriptionIds,
            String query,
            String skipToken,
            int pageSize,
            AccessCredential credential
    );

    /**
     * Read subscription metadata. Used to prove a credential can see a subscription.
     */
    SubscriptionInfo getSubscription(String subscriptionId, AccessCredential credential);

    record ResourceGraphPage(
            List<ResourceSnapshot> resources,
            String skipToken,
            long totalRecords
    ) {
        public boolean hasMore() {
            return skipToken != null && !skipToken.isBlank();
        }
    }

    record SubscriptionInfo(
            String subscriptionId,
            String displayName,
            String state
    ) {}
}
