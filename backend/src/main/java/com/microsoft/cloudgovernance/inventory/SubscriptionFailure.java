package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.adapters.ResourceGraphException.ErrorKind;

/**
 * A subscription whose inventory could not be fetched.
 *
 * @param kind null when the failure was not a Resource Graph error (e.g. cancellation)
 */
public record SubscriptionFailure(String subscriptionId, ErrorKind kind, String message) {

    public boolean isAuthorizationFailure() {
        return kind != null && kind.isAuthorizationFailure();
    }

    public String summary() {
        return subscriptionId + ":" + (kind == null ? "ERROR" : kind.name());
    }
}
