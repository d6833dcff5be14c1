package com.microsoft.cloudgovernance.licensing;

import com.microsoft.cloudgovernance.domain.model.LicenseFeature;

import java.util.Set;
import java.util.UUID;

/**
 * Usage against plan limits for the current billing period.
 */
public record UsageReport(
        UUID organizationId,
        String planType,
        String billingPeriod,
        long assessmentsStarted,
        long assessmentsCompleted,
        Integer maxAssessments,
        Integer maxSubscriptions,
        Double percentUsed,
        Set<LicenseFeature> features
) {
    public Long remainingAssessments() {
        return maxAssessments == null ? null : Math.max(0, maxAssessments - assessmentsStarted);
    }
}
