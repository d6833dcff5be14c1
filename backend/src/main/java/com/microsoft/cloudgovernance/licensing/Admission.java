package com.microsoft.cloudgovernance.licensing;

/**
 * License gate decision.
 *
 * @param maxAllowed null when the plan is unlimited
 */
public record Admission(
        boolean allowed,
        AdmissionReason reason,
        String message,
        long currentUsage,
        Integer maxAllowed
) {
    public static Admission allowed(long currentUsage, Integer maxAllowed) {
        return new Admission(true, AdmissionReason.ALLOWED, null, currentUsage, maxAllowed);
    }

    public static Admission denied(AdmissionReason reason, String message, long currentUsage, Integer maxAllowed) {
        return new Admission(false, reason, message, currentUsage, maxAllowed);
    }

    public String reasonCode() {
        return reason.getCode();
    }
}
