package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.*;

public record FindingView(
        Long id,
        FindingCategory category,
        ViolationRule rule,
        Severity severity,
        String resourceId,
        String resourceName,
        String resourceType,
        String issue,
        String recommendation,
        EffortLevel estimatedEffort
) {
    public static FindingView from(Finding finding) {
        return new FindingView(
                finding.getId(),
                finding.getCategory(),
                finding.getRule(),
                finding.getSeverity(),
                finding.getResourceId(),
                finding.getResourceName(),
                finding.getResourceType(),
                finding.getIssue(),
                finding.getRecommendation(),
                finding.getEstimatedEffort()
        );
    }
}
