package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Inventory snapshot row captured for one assessment.
 */
@Entity
@Table(name = "assessment_resources", indexes = {
    @Index(name = "idx_assessment_resource", columnList = "assessmentId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssessmentResource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID assessmentId;

    @Column(length = 512)
    private String resourceId;

    @Column(length = 256)
    private String name;

    @Column(length = 256)
    private String type;

    @Column(length = 128)
    private String resourceGroup;

    @Column(length = 64)
    private String location;

    @Column(length = 64)
    private String subscriptionId;

    @Column(length = 128)
    private String kind;

    @Column(length = 128)
    private String sku;

    /**
     * JSON object of tag key to value.
     */
    @Column(columnDefinition = "TEXT")
    private String tags;

    @Column(nullable = false)
    private LocalDateTime capturedAt;

    @PrePersist
    protected void onCreate() {
        if (capturedAt == null) {
            capturedAt = LocalDateTime.now();
        }
    }
}
