package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.AnalyzerKind;
import com.microsoft.cloudgovernance.domain.model.AssessmentType;
import com.microsoft.cloudgovernance.domain.model.CredentialPath;
import com.microsoft.cloudgovernance.domain.model.Severity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Summary of a completed assessment.
 */
public record AssessmentResultView(
        UUID id,
        String name,
        AssessmentType type,
        BigDecimal overallScore,
        Map<AnalyzerKind, BigDecimal> analyzerScores,
        Integer resourceCount,
        long findingCount,
        Map<Severity, Long> findingsBySeverity,
        CredentialPath credentialPath,
        String failedSubscriptions,
        LocalDateTime completedAt
) {}
