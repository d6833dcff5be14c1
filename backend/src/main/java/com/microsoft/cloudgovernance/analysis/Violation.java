package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.EffortLevel;
import com.microsoft.cloudgovernance.domain.model.FindingCategory;
import com.microsoft.cloudgovernance.domain.model.Severity;
import com.microsoft.cloudgovernance.domain.model.ViolationRule;

/**
 * One rule breach found by an analyzer. Severity comes from the rule.
 */
public record Violation(
        ViolationRule rule,
        String resourceId,
        String resourceName,
        String resourceType,
        String issue,
        String recommendation,
        EffortLevel effort
) {
    public Severity severity() {
        return rule.getSeverity();
    }

    public FindingCategory category() {
        return rule.getCategory();
    }
}
