package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.FindingCategory;
import com.microsoft.cloudgovernance.domain.model.Severity;

/**
 * Optional narrowing of a findings listing. Null fields match everything.
 */
public record FindingFilter(FindingCategory category, Severity severity) {

    public static FindingFilter none() {
        return new FindingFilter(null, null);
    }
}
