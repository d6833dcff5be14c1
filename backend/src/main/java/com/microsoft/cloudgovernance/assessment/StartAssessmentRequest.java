package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.AssessmentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Input for starting an assessment.
 *
 * @param clientId must match the environment's client when given
 * @param subscriptionIds subset of the environment's subscriptions; all of them when empty
 */
public record StartAssessmentRequest(
        @NotNull UUID environmentId,
        UUID clientId,
        List<String> subscriptionIds,
        @NotNull AssessmentType type,
        @Valid AssessmentOptions options,
        boolean useClientPreferences
) {
    public AssessmentOptions effectiveOptions() {
        return options != null ? options : AssessmentOptions.defaults();
    }
}
