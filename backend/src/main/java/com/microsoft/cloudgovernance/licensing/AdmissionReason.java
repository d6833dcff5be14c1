package com.microsoft.cloudgovernance.licensing;

public enum AdmissionReason {
    ALLOWED("Allowed"),
    LIMIT_REACHED("LimitReached"),
    NO_ACTIVE_SUBSCRIPTION("NoActiveSubscription"),
    SUBSCRIPTION_EXPIRED("SubscriptionExpired"),
    SUBSCRIPTION_LIMIT_REACHED("SubscriptionLimitReached");

    private final String code;

    AdmissionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
