package com.microsoft.cloudgovernance.domain.model;

public enum PlanStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCELLED,
    EXPIRED;

    public boolean isUsable() {
        return this == TRIALING || this == ACTIVE;
    }
}
