package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Usage count for one metric in one billing period.
 *
 * Only ever changed by conditional UPDATE statements so that concurrent
 * increments cannot overshoot a plan limit.
 */
@Entity
@Table(name = "usage_counters", uniqueConstraints = {
    @UniqueConstraint(name = "uk_usage_counter", columnNames = {"organizationId", "metricType", "billingPeriod"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private UsageMetric metricType;

    /**
     * "yyyy-MM" for calendar months, "yyyy-MM-dd" of the period start for anchored plans.
     */
    @Column(nullable = false, length = 10)
    private String billingPeriod;

    @Column(nullable = false)
    private long usageCount;

    private LocalDateTime updatedAt;
}
