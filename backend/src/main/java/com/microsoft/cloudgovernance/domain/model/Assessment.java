package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * One run of the governance assessment pipeline.
 *
 * STATE MACHINE:
 * PENDING -> IN_PROGRESS -> COMPLETED | FAILED
 *
 * Status is only changed through the transition methods below, which
 * refuse to leave a terminal state. Re-running an assessment creates a new row.
 */
@Entity
@Table(name = "assessments", indexes = {
    @Index(name = "idx_assessment_org", columnList = "organizationId, createdAt"),
    @Index(name = "idx_assessment_status", columnList = "status, createdAt"),
    @Index(name = "idx_assessment_env", columnList = "environmentId")
})
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Assessment {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID organizationId;

    /**
     * MSP client the assessed environment belongs to, if any.
     */
    private UUID clientId;

    /**
     * User who started the run.
     */
    @Column(nullable = false)
    private UUID customerId;

    @Column(nullable = false)
    private UUID environmentId;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AssessmentType assessmentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AssessmentStatus status;

    /**
     * Subscriptions inspected, comma separated.
     */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String subscriptionIds;

    @Column(nullable = false)
    private boolean useClientPreferences;

    /**
     * Whether the fetched inventory is stored alongside the findings.
     */
    @Column(nullable = false)
    private boolean captureInventory;

    @Column(precision = 5, scale = 2)
    private BigDecimal overallScore;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "assessment_analyzer_scores", joinColumns = @JoinColumn(name = "assessment_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "analyzer", length = 16)
    @Column(name = "score", precision = 5, scale = 2)
    @Builder.Default
    private Map<AnalyzerKind, BigDecimal> analyzerScores = new EnumMap<>(AnalyzerKind.class);

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    private FailureReason failureReason;

    @Column(length = 2000)
    private String failureDetail;

    @Enumerated(EnumType.STRING)
    @Column(length = 24)
    private CredentialPath credentialPath;

    private Integer resourceCount;

    /**
     * Subscriptions that could not be fetched, with the error kind, e.g. "sub-1:FORBIDDEN".
     */
    @Column(columnDefinition = "TEXT")
    private String failedSubscriptions;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = AssessmentStatus.PENDING;
        }
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public void markInProgress(LocalDateTime now) {
        requireStatus(AssessmentStatus.PENDING, AssessmentStatus.IN_PROGRESS);
        this.status = AssessmentStatus.IN_PROGRESS;
        this.startedAt = now;
    }

    public void recordCredentialPath(CredentialPath path) {
        requireStatus(AssessmentStatus.IN_PROGRESS, status);
        this.credentialPath = path;
    }

    public void recordInventory(int resourceCount, String failedSubscriptions) {
        requireStatus(AssessmentStatus.IN_PROGRESS, status);
        this.resourceCount = resourceCount;
        this.failedSubscriptions = failedSubscriptions;
    }

    public void complete(BigDecimal overallScore, Map<AnalyzerKind, BigDecimal> scores, LocalDateTime now) {
        requireStatus(AssessmentStatus.IN_PROGRESS, AssessmentStatus.COMPLETED);
        this.overallScore = overallScore;
        this.analyzerScores.clear();
        this.analyzerScores.putAll(scores);
        this.status = AssessmentStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Moves a non-terminal assessment to FAILED.
     */
    public void fail(FailureReason reason, String detail, LocalDateTime now) {
        if (isTerminal()) {
            throw new IllegalStateException(
                    "Assessment " + id + " is already " + status + " and cannot fail");
        }
        this.status = AssessmentStatus.FAILED;
        this.failureReason = reason;
        this.failureDetail = detail != null && detail.length() > 2000 ? detail.substring(0, 2000) : detail;
        this.completedAt = now;
    }

    private void requireStatus(AssessmentStatus expected, AssessmentStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Assessment " + id + " cannot move from " + status + " to " + target);
        }
    }
}
