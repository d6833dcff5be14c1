package com.microsoft.cloudgovernance.assessment;

import jakarta.validation.constraints.Size;

/**
 * Optional knobs for a run.
 *
 * @param name display name; generated from the environment when blank
 * @param includeInventorySnapshot store the fetched resources with the assessment
 */
public record AssessmentOptions(
        @Size(max = 200) String name,
        Boolean includeInventorySnapshot
) {
    public static AssessmentOptions defaults() {
        return new AssessmentOptions(null, true);
    }

    public boolean captureInventory() {
        return includeInventorySnapshot == null || includeInventorySnapshot;
    }
}
