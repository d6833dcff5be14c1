package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A single policy violation recorded for an assessment.
 *
 * Findings are written once when the analysis stage finishes and are only
 * removed together with their assessment.
 */
@Entity
@Table(name = "assessment_findings", indexes = {
    @Index(name = "idx_finding_assessment", columnList = "assessmentId, category, severity")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Finding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID assessmentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FindingCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ViolationRule rule;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(length = 512)
    private String resourceId;

    @Column(length = 256)
    private String resourceName;

    @Column(length = 256)
    private String resourceType;

    @Column(nullable = false, length = 1000)
    private String issue;

    @Column(length = 1000)
    private String recommendation;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private EffortLevel estimatedEffort;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (severity == null && rule != null) {
            severity = rule.getSeverity();
        }
    }
}
