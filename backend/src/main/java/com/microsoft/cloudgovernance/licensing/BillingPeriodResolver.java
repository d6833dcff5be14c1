package com.microsoft.cloudgovernance.licensing;

import com.microsoft.cloudgovernance.domain.model.OrganizationPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Maps "now" to the billing period key used by usage counters.
 *
 * - No anchor day: calendar month, "yyyy-MM"
 * - Anchor day d: the period started on day d of this or the previous month
 *   (clamped to the month length), keyed "yyyy-MM-dd" by its start date
 */
@Component
@RequiredArgsConstructor
public class BillingPeriodResolver {

    private final Clock clock;

    public String currentPeriod(OrganizationPlan plan) {
        LocalDate today = LocalDate.now(clock);
        Integer anchorDay = plan == null ? null : plan.getBillingAnchorDay();
        if (anchorDay == null || anchorDay < 1) {
            return YearMonth.from(today).toString();
        }
        LocalDate start = anchorIn(YearMonth.from(today), anchorDay);
        if (today.isBefore(start)) {
            start = anchorIn(YearMonth.from(today).minusMonths(1), anchorDay);
        }
        return start.toString();
    }

    private static LocalDate anchorIn(YearMonth month, int anchorDay) {
        return month.atDay(Math.min(anchorDay, month.lengthOfMonth()));
    }
}
