package com.microsoft.cloudgovernance.licensing;

import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.OrganizationPlanRepository;
import com.microsoft.cloudgovernance.domain.repository.UsageCounterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Plan limits, usage counters and feature flags per organization.
 *
 * ADMISSION FLOW:
 * 1. Organization must have a usable plan (active, or trial not yet ended)
 * 2. Requested subscription count must fit the plan
 * 3. Assessment counter for the billing period is incremented with a single
 *    conditional UPDATE (count < limit), so concurrent starts cannot overshoot
 *
 * A denied admission never creates or changes a counter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LicenseGate {

    private static final double WARNING_THRESHOLD = 0.8;

    private final OrganizationPlanRepository planRepository;
    private final UsageCounterRepository usageCounterRepository;
    private final BillingPeriodResolver billingPeriodResolver;
    private final Clock clock;

    /**
     * Read-only admission check. Does not reserve anything.
     */
    public Admission canStartAssessment(UUID organizationId) {
        Optional<OrganizationPlan> maybePlan = planRepository.findByOrganizationId(organizationId);
        if (maybePlan.isEmpty()) {
            return Admission.denied(AdmissionReason.NO_ACTIVE_SUBSCRIPTION,
                    "Organization has no subscription plan", 0, 0);
        }
        OrganizationPlan plan = maybePlan.get();
        Admission planCheck = checkPlanStatus(plan);
        if (planCheck != null) {
            return planCheck;
        }

        long current = currentUsage(organizationId, UsageMetric.ASSESSMENT_RUN, plan);
        Integer limit = plan.getMaxAssessmentsPerMonth();
        if (limit != null && current >= limit) {
            return Admission.denied(AdmissionReason.LIMIT_REACHED,
                    "Monthly assessment limit of " + limit + " reached", current, limit);
        }
        return Admission.allowed(current, limit);
    }

    /**
     * Admit an assessment and count it against the plan in one atomic step.
     *
     * @param subscriptionCount number of subscriptions the assessment will inspect
     */
    public Admission reserveAssessment(UUID organizationId, int subscriptionCount) {
        Admission admission = canStartAssessment(organizationId);
        if (!admission.allowed()) {
            log.info("Assessment denied for organization: {} ({})", organizationId, admission.reasonCode());
            return admission;
        }

        OrganizationPlan plan = planRepository.findByOrganizationId(organizationId).orElseThrow();
        Integer maxSubscriptions = plan.getMaxSubscriptions();
        if (maxSubscriptions != null && subscriptionCount > maxSubscriptions) {
            log.info("Assessment denied for organization: {}: {} subscriptions exceed plan limit {}",
                    organizationId, subscriptionCount, maxSubscriptions);
            return Admission.denied(AdmissionReason.SUBSCRIPTION_LIMIT_REACHED,
                    "Plan allows " + maxSubscriptions + " subscriptions per assessment",
                    subscriptionCount, maxSubscriptions);
        }

        String period = billingPeriodResolver.currentPeriod(plan);
        ensureCounter(organizationId, UsageMetric.ASSESSMENT_RUN, period);
        LocalDateTime now = LocalDateTime.now(clock);

        Integer limit = plan.getMaxAssessmentsPerMonth();
        if (limit == null) {
            usageCounterRepository.increment(organizationId, UsageMetric.ASSESSMENT_RUN, period, now);
            return Admission.allowed(currentUsage(organizationId, UsageMetric.ASSESSMENT_RUN, period), null);
        }

        int updated = usageCounterRepository.incrementIfBelow(
                organizationId, UsageMetric.ASSESSMENT_RUN, period, limit, now);
        long current = currentUsage(organizationId, UsageMetric.ASSESSMENT_RUN, period);
        if (updated == 0) {
            log.info("Assessment denied for organization: {}: limit {} reached concurrently", organizationId, limit);
            return Admission.denied(AdmissionReason.LIMIT_REACHED,
                    "Monthly assessment limit of " + limit + " reached", current, limit);
        }

        warnOnThreshold(organizationId, current, limit);
        return Admission.allowed(current, limit);
    }

    /**
     * Give a reserved run back when the assessment it was reserved for was never created.
     */
    public void releaseAssessment(UUID organizationId) {
        OrganizationPlan plan = planRepository.findByOrganizationId(organizationId).orElse(null);
        String period = billingPeriodResolver.currentPeriod(plan);
        int released = usageCounterRepository.decrement(
                organizationId, UsageMetric.ASSESSMENT_RUN, period, LocalDateTime.now(clock));
        if (released == 0) {
            log.warn("No reserved assessment to release for organization: {} in period {}", organizationId, period);
        } else {
            log.info("Released reserved assessment for organization: {} in period {}", organizationId, period);
        }
    }

    /**
     * Unconditionally count one unit of usage for the current billing period.
     */
    public void recordUsage(UUID organizationId, UsageMetric metric) {
        OrganizationPlan plan = planRepository.findByOrganizationId(organizationId).orElse(null);
        String period = billingPeriodResolver.currentPeriod(plan);
        ensureCounter(organizationId, metric, period);
        usageCounterRepository.increment(organizationId, metric, period, LocalDateTime.now(clock));
        log.debug("Recorded {} for organization: {} in period {}", metric, organizationId, period);
    }

    public boolean hasFeature(UUID organizationId, LicenseFeature feature) {
        return planRepository.findByOrganizationId(organizationId)
                .filter(plan -> checkPlanStatus(plan) == null)
                .map(plan -> featuresOf(plan).contains(feature))
                .orElse(false);
    }

    public UsageReport getUsageReport(UUID organizationId) {
        OrganizationPlan plan = planRepository.findByOrganizationId(organizationId).orElse(null);
        String period = billingPeriodResolver.currentPeriod(plan);
        long started = currentUsage(organizationId, UsageMetric.ASSESSMENT_RUN, period);
        long completed = currentUsage(organizationId, UsageMetric.ASSESSMENT_COMPLETED, period);
        Integer limit = plan == null ? Integer.valueOf(0) : plan.getMaxAssessmentsPerMonth();
        Double percentUsed = limit == null || limit == 0 ? null : started * 100.0 / limit;

        return new UsageReport(
                organizationId,
                plan == null ? null : plan.getPlanType(),
                period,
                started,
                completed,
                limit,
                plan == null ? null : plan.getMaxSubscriptions(),
                percentUsed,
                plan == null ? Set.of() : featuresOf(plan)
        );
    }

    private Admission checkPlanStatus(OrganizationPlan plan) {
        if (plan.getStatus() == null || !plan.getStatus().isUsable()) {
            return Admission.denied(AdmissionReason.NO_ACTIVE_SUBSCRIPTION,
                    "Subscription is " + plan.getStatus(), 0, plan.getMaxAssessmentsPerMonth());
        }
        if (plan.getStatus() == PlanStatus.TRIALING && plan.getTrialEndsAt() != null
                && plan.getTrialEndsAt().isBefore(LocalDateTime.now(clock))) {
            return Admission.denied(AdmissionReason.SUBSCRIPTION_EXPIRED,
                    "Trial ended on " + plan.getTrialEndsAt().toLocalDate(), 0, plan.getMaxAssessmentsPerMonth());
        }
        return null;
    }

    private long currentUsage(UUID organizationId, UsageMetric metric, OrganizationPlan plan) {
        return currentUsage(organizationId, metric, billingPeriodResolver.currentPeriod(plan));
    }

    private long currentUsage(UUID organizationId, UsageMetric metric, String period) {
        return usageCounterRepository
                .findByOrganizationIdAndMetricTypeAndBillingPeriod(organizationId, metric, period)
                .map(UsageCounter::getUsageCount)
                .orElse(0L);
    }

    /**
     * Create the period's counter row if missing. A concurrent creator winning the
     * unique constraint is fine; the row exists either way.
     */
    private void ensureCounter(UUID organizationId, UsageMetric metric, String period) {
        if (usageCounterRepository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(organizationId, metric, period)) {
            return;
        }
        try {
            usageCounterRepository.saveAndFlush(UsageCounter.builder()
                    .organizationId(organizationId)
                    .metricType(metric)
                    .billingPeriod(period)
                    .usageCount(0)
                    .updatedAt(LocalDateTime.now(clock))
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.debug("Usage counter {} / {} for organization: {} created concurrently", metric, period, organizationId);
        }
    }

    private void warnOnThreshold(UUID organizationId, long current, int limit) {
        if (current >= limit) {
            log.warn("Organization: {} has used all {} assessments for this period", organizationId, limit);
        } else if (current >= Math.ceil(limit * WARNING_THRESHOLD)) {
            log.warn("Organization: {} has used {} of {} assessments for this period", organizationId, current, limit);
        }
    }

    private static Set<LicenseFeature> featuresOf(OrganizationPlan plan) {
        Set<LicenseFeature> features = EnumSet.noneOf(LicenseFeature.class);
        if (Boolean.TRUE.equals(plan.getIncludesApiAccess())) {
            features.add(LicenseFeature.API_ACCESS);
        }
        if (Boolean.TRUE.equals(plan.getIncludesWhiteLabel())) {
            features.add(LicenseFeature.WHITE_LABEL);
        }
        if (Boolean.TRUE.equals(plan.getIncludesCustomBranding())) {
            features.add(LicenseFeature.CUSTOM_BRANDING);
        }
        if (plan.getMaxAssessmentsPerMonth() == null) {
            features.add(LicenseFeature.UNLIMITED_ASSESSMENTS);
        }
        return features;
    }
}
