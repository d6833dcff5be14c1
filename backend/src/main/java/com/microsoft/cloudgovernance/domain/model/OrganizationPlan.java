package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The license an organization is on. Null limits mean unlimited.
 */
@Entity
@Table(name = "organization_plans", indexes = {
    @Index(name = "idx_plan_org", columnList = "organizationId", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrganizationPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private UUID organizationId;

    @Column(nullable = false, length = 32)
    private String planType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PlanStatus status;

    private Integer maxAssessmentsPerMonth;

    private Integer maxSubscriptions;

    private Boolean includesApiAccess;

    private Boolean includesWhiteLabel;

    private Boolean includesCustomBranding;

    private LocalDateTime trialEndsAt;

    /**
     * Day of month the billing period starts on. Null uses calendar months.
     */
    private Integer billingAnchorDay;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = PlanStatus.ACTIVE;
        }
    }
}
