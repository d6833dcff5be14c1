package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.UsageCounter;
import com.microsoft.cloudgovernance.domain.model.UsageMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UsageCounterRepository extends JpaRepository<UsageCounter, Long> {

    Optional<UsageCounter> findByOrganizationIdAndMetricTypeAndBillingPeriod(
            UUID organizationId, UsageMetric metricType, String billingPeriod);

    boolean existsByOrganizationIdAndMetricTypeAndBillingPeriod(
            UUID organizationId, UsageMetric metricType, String billingPeriod);

    /**
     * Increments the counter only while it is below the limit.
     *
     * @return 1 if the increment happened, 0 if the limit was already reached
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE UsageCounter u SET u.usageCount = u.usageCount + 1, u.updatedAt = :now " +
           "WHERE u.organizationId = :organizationId AND u.metricType = :metricType " +
           "AND u.billingPeriod = :billingPeriod AND u.usageCount < :limit")
    int incrementIfBelow(
            @Param("organizationId") UUID organizationId,
            @Param("metricType") UsageMetric metricType,
            @Param("billingPeriod") String billingPeriod,
            @Param("limit") long limit,
            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE UsageCounter u SET u.usageCount = u.usageCount + 1, u.updatedAt = :now " +
           "WHERE u.organizationId = :organizationId AND u.metricType = :metricType " +
           "AND u.billingPeriod = :billingPeriod")
    int increment(
            @Param("organizationId") UUID organizationId,
            @Param("metricType") UsageMetric metricType,
            @Param("billingPeriod") String billingPeriod,
            @Param("now") LocalDateTime now);

    /**
     * Gives back one unit, never going below zero.
     *
     * @return 1 if a unit was released, 0 if the counter was already empty or missing
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE UsageCounter u SET u.usageCount = u.usageCount - 1, u.updatedAt = :now " +
           "WHERE u.organizationId = :organizationId AND u.metricType = :metricType " +
           "AND u.billingPeriod = :billingPeriod AND u.usageCount > 0")
    int decrement(
            @Param("organizationId") UUID organizationId,
            @Param("metricType") UsageMetric metricType,
            @Param("billingPeriod") String billingPeriod,
            @Param("now") LocalDateTime now);
}
