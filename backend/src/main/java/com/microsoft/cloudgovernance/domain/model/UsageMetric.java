package com.microsoft.cloudgovernance.domain.model;

/**
 * Usage counters tracked per organization and billing period.
 */
public enum UsageMetric {
    /** Incremented when an assessment is admitted. Capped by the plan. */
    ASSESSMENT_RUN,
    /** Incremented when an assessment reaches COMPLETED. */
    ASSESSMENT_COMPLETED
}
