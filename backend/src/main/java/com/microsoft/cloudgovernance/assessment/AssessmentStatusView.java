package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.*;

import java.time.LocalDateTime;
import java.util.UUID;

public record AssessmentStatusView(
        UUID id,
        String name,
        UUID environmentId,
        AssessmentType type,
        AssessmentStatus status,
        String failureReason,
        String failureDetail,
        CredentialPath credentialPath,
        Integer resourceCount,
        String failedSubscriptions,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {
    public static AssessmentStatusView from(Assessment assessment) {
        return new AssessmentStatusView(
                assessment.getId(),
                assessment.getName(),
                assessment.getEnvironmentId(),
                assessment.getAssessmentType(),
                assessment.getStatus(),
                assessment.getFailureReason() == null ? null : assessment.getFailureReason().getCode(),
                assessment.getFailureDetail(),
                assessment.getCredentialPath(),
                assessment.getResourceCount(),
                assessment.getFailedSubscriptions(),
                assessment.getCreatedAt(),
                assessment.getStartedAt(),
                assessment.getCompletedAt()
        );
    }
}
