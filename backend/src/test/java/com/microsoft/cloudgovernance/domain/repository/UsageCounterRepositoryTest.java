package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.UsageCounter;
import com.microsoft.cloudgovernance.domain.model.UsageMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class UsageCounterRepositoryTest {

    @Autowired
    private UsageCounterRepository repository;

    @Test
    @DisplayName("Should only increment while the counter is below the limit")
    void shouldIncrementConditionally() {
        // Given
        UUID organizationId = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.of(2026, 3, 15, 12, 0);
        repository.saveAndFlush(UsageCounter.builder()
                .organizationId(organizationId)
                .metricType(UsageMetric.ASSESSMENT_RUN)
                .billingPeriod("2026-03")
                .usageCount(1)
                .updatedAt(now)
                .build());

        // When
        int first = repository.incrementIfBelow(organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03", 2, now);
        int second = repository.incrementIfBelow(organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03", 2, now);

        // Then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(repository.findByOrganizationIdAndMetricTypeAndBillingPeriod(
                organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03"))
                .get()
                .extracting(UsageCounter::getUsageCount)
                .isEqualTo(2L);
    }

    @Test
    @DisplayName("Should keep billing periods apart")
    void shouldScopeByPeriod() {
        UUID organizationId = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.of(2026, 3, 15, 12, 0);
        repository.saveAndFlush(UsageCounter.builder()
                .organizationId(organizationId)
                .metricType(UsageMetric.ASSESSMENT_RUN)
                .billingPeriod("2026-02")
                .usageCount(5)
                .updatedAt(now)
                .build());

        assertThat(repository.incrementIfBelow(organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03", 5, now)).isZero();
        assertThat(repository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(
                organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03")).isFalse();
    }

    @Test
    @DisplayName("Should release a unit without going below zero")
    void shouldDecrementToZeroOnly() {
        UUID organizationId = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.of(2026, 3, 15, 12, 0);
        repository.saveAndFlush(UsageCounter.builder()
                .organizationId(organizationId)
                .metricType(UsageMetric.ASSESSMENT_RUN)
                .billingPeriod("2026-03")
                .usageCount(1)
                .updatedAt(now)
                .build());

        assertThat(repository.decrement(organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03", now)).isEqualTo(1);
        assertThat(repository.decrement(organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03", now)).isZero();
        assertThat(repository.findByOrganizationIdAndMetricTypeAndBillingPeriod(
                organizationId, UsageMetric.ASSESSMENT_RUN, "2026-03"))
                .get()
                .extracting(UsageCounter::getUsageCount)
                .isEqualTo(0L);
    }
}
