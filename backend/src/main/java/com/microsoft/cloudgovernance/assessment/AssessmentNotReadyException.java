package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.AssessmentStatus;
import com.microsoft.cloudgovernance.domain.model.FailureReason;

import java.util.UUID;

/**
 * Result requested before the assessment completed (or after it failed).
 */
public class AssessmentNotReadyException extends RuntimeException {

    private final UUID assessmentId;
    private final AssessmentStatus status;
    private final FailureReason failureReason;

    public AssessmentNotReadyException(UUID assessmentId, AssessmentStatus status, FailureReason failureReason) {
        super("Assessment " + assessmentId + " is " + status
                + (failureReason != null ? " (" + failureReason.getCode() + ")" : ""));
        this.assessmentId = assessmentId;
        this.status = status;
        this.failureReason = failureReason;
    }

    public UUID getAssessmentId() {
        return assessmentId;
    }

    public AssessmentStatus getStatus() {
        return status;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }
}
