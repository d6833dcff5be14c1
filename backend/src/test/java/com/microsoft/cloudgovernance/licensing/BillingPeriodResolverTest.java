package com.microsoft.cloudgovernance.licensing;

import com.microsoft.cloudgovernance.domain.model.OrganizationPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class BillingPeriodResolverTest {

    private static BillingPeriodResolver at(String instant) {
        return new BillingPeriodResolver(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    private static OrganizationPlan anchoredOn(Integer day) {
        return OrganizationPlan.builder().billingAnchorDay(day).build();
    }

    @Test
    @DisplayName("Should use the calendar month without an anchor day")
    void shouldUseCalendarMonth() {
        assertThat(at("2026-03-15T12:00:00Z").currentPeriod(null)).isEqualTo("2026-03");
        assertThat(at("2026-03-15T12:00:00Z").currentPeriod(anchoredOn(null))).isEqualTo("2026-03");
    }

    @Test
    @DisplayName("Should start the period on the anchor day of this month once reached")
    void shouldUseAnchorInCurrentMonth() {
        assertThat(at("2026-03-20T00:00:00Z").currentPeriod(anchoredOn(10))).isEqualTo("2026-03-10");
        assertThat(at("2026-03-10T00:00:00Z").currentPeriod(anchoredOn(10))).isEqualTo("2026-03-10");
    }

    @Test
    @DisplayName("Should fall back to the previous month's anchor before the anchor day")
    void shouldUsePreviousAnchor() {
        assertThat(at("2026-03-05T00:00:00Z").currentPeriod(anchoredOn(10))).isEqualTo("2026-02-10");
        assertThat(at("2026-01-05T00:00:00Z").currentPeriod(anchoredOn(10))).isEqualTo("2025-12-10");
    }

    @Test
    @DisplayName("Should clamp the anchor to short months")
    void shouldClampToMonthLength() {
        assertThat(at("2026-02-28T00:00:00Z").currentPeriod(anchoredOn(31))).isEqualTo("2026-02-28");
        assertThat(at("2026-03-15T00:00:00Z").currentPeriod(anchoredOn(31))).isEqualTo("2026-02-28");
    }
}
