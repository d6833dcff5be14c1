package com.microsoft.cloudgovernance.licensing;

import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.OrganizationPlanRepository;
import com.microsoft.cloudgovernance.domain.repository.UsageCounterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LicenseGateTest {

    private static final UUID ORG_ID = UUID.randomUUID();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);
    private static final String PERIOD = "2026-03";

    @Mock
    private OrganizationPlanRepository planRepository;

    @Mock
    private UsageCounterRepository usageCounterRepository;

    private LicenseGate licenseGate;

    @BeforeEach
    void setUp() {
        licenseGate = new LicenseGate(planRepository, usageCounterRepository, new BillingPeriodResolver(CLOCK), CLOCK);
    }

    private static OrganizationPlan plan(PlanStatus status, Integer maxAssessments, Integer maxSubscriptions) {
        return OrganizationPlan.builder()
                .organizationId(ORG_ID)
                .planType("PROFESSIONAL")
                .status(status)
                .maxAssessmentsPerMonth(maxAssessments)
                .maxSubscriptions(maxSubscriptions)
                .includesApiAccess(true)
                .includesWhiteLabel(false)
                .includesCustomBranding(false)
                .build();
    }

    private static Optional<UsageCounter> counter(long count) {
        return Optional.of(UsageCounter.builder()
                .organizationId(ORG_ID)
                .metricType(UsageMetric.ASSESSMENT_RUN)
                .billingPeriod(PERIOD)
                .usageCount(count)
                .build());
    }

    private void usage(Optional<UsageCounter> first, Optional<UsageCounter> second) {
        when(usageCounterRepository.findByOrganizationIdAndMetricTypeAndBillingPeriod(
                ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(first, second);
    }

    @Nested
    @DisplayName("Denials")
    class DenialTests {

        @Test
        @DisplayName("Should deny with LimitReached at the monthly limit and leave the counter alone")
        void shouldDenyAtLimit() {
            // Given
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 10)));
            usage(counter(5), counter(5));

            // When
            Admission admission = licenseGate.reserveAssessment(ORG_ID, 1);

            // Then
            assertThat(admission.allowed()).isFalse();
            assertThat(admission.reasonCode()).isEqualTo("LimitReached");
            assertThat(admission.currentUsage()).isEqualTo(5);
            assertThat(admission.maxAllowed()).isEqualTo(5);
            verify(usageCounterRepository, never()).incrementIfBelow(any(), any(), any(), anyLong(), any());
            verify(usageCounterRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should deny organizations without a plan")
        void shouldDenyWithoutPlan() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.empty());

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 1);

            assertThat(admission.reason()).isEqualTo(AdmissionReason.NO_ACTIVE_SUBSCRIPTION);
            verifyNoInteractions(usageCounterRepository);
        }

        @Test
        @DisplayName("Should deny cancelled plans")
        void shouldDenyCancelledPlan() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.CANCELLED, 5, 10)));

            assertThat(licenseGate.canStartAssessment(ORG_ID).reason()).isEqualTo(AdmissionReason.NO_ACTIVE_SUBSCRIPTION);
        }

        @Test
        @DisplayName("Should deny a trial that has ended")
        void shouldDenyExpiredTrial() {
            OrganizationPlan trial = plan(PlanStatus.TRIALING, 5, 10);
            trial.setTrialEndsAt(LocalDateTime.of(2026, 3, 1, 0, 0));
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(trial));

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 1);

            assertThat(admission.reasonCode()).isEqualTo("SubscriptionExpired");
        }

        @Test
        @DisplayName("Should deny assessments spanning more subscriptions than the plan allows")
        void shouldDenySubscriptionLimit() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 2)));
            usage(counter(1), counter(1));

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 3);

            assertThat(admission.reason()).isEqualTo(AdmissionReason.SUBSCRIPTION_LIMIT_REACHED);
            assertThat(admission.currentUsage()).isEqualTo(3);
            assertThat(admission.maxAllowed()).isEqualTo(2);
            verify(usageCounterRepository, never()).incrementIfBelow(any(), any(), any(), anyLong(), any());
        }

        @Test
        @DisplayName("Should deny when a concurrent start took the last slot")
        void shouldDenyWhenConditionalIncrementLoses() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 10)));
            usage(counter(4), counter(5));
            when(usageCounterRepository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(true);
            when(usageCounterRepository.incrementIfBelow(eq(ORG_ID), eq(UsageMetric.ASSESSMENT_RUN), eq(PERIOD),
                    eq(5L), any())).thenReturn(0);

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 1);

            assertThat(admission.allowed()).isFalse();
            assertThat(admission.reason()).isEqualTo(AdmissionReason.LIMIT_REACHED);
            assertThat(admission.currentUsage()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Admissions")
    class AdmissionTests {

        @Test
        @DisplayName("Should admit below the limit and count the assessment")
        void shouldAdmitAndIncrement() {
            // Given
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 10)));
            usage(counter(2), counter(3));
            when(usageCounterRepository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(true);
            when(usageCounterRepository.incrementIfBelow(eq(ORG_ID), eq(UsageMetric.ASSESSMENT_RUN), eq(PERIOD),
                    eq(5L), any())).thenReturn(1);

            // When
            Admission admission = licenseGate.reserveAssessment(ORG_ID, 2);

            // Then
            assertThat(admission.allowed()).isTrue();
            assertThat(admission.currentUsage()).isEqualTo(3);
            assertThat(admission.maxAllowed()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should create the period counter on first use")
        void shouldCreateCounter() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 10)));
            usage(Optional.empty(), counter(1));
            when(usageCounterRepository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(false);
            when(usageCounterRepository.incrementIfBelow(any(), any(), any(), anyLong(), any())).thenReturn(1);

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 1);

            assertThat(admission.allowed()).isTrue();
            verify(usageCounterRepository).saveAndFlush(argThat(c -> c.getBillingPeriod().equals(PERIOD)
                    && c.getUsageCount() == 0));
        }

        @Test
        @DisplayName("Should count unlimited plans without a limit check")
        void shouldAdmitUnlimitedPlan() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, null, null)));
            usage(counter(41), counter(42));
            when(usageCounterRepository.existsByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(true);

            Admission admission = licenseGate.reserveAssessment(ORG_ID, 25);

            assertThat(admission.allowed()).isTrue();
            assertThat(admission.maxAllowed()).isNull();
            verify(usageCounterRepository).increment(eq(ORG_ID), eq(UsageMetric.ASSESSMENT_RUN), eq(PERIOD), any());
            verify(usageCounterRepository, never()).incrementIfBelow(any(), any(), any(), anyLong(), any());
        }

        @Test
        @DisplayName("Should release a reserved run in the current billing period")
        void shouldReleaseReservation() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, null)));
            when(usageCounterRepository.decrement(eq(ORG_ID), eq(UsageMetric.ASSESSMENT_RUN), eq(PERIOD), any()))
                    .thenReturn(1);

            licenseGate.releaseAssessment(ORG_ID);

            verify(usageCounterRepository).decrement(eq(ORG_ID), eq(UsageMetric.ASSESSMENT_RUN), eq(PERIOD), any());
        }
    }

    @Nested
    @DisplayName("Features and usage")
    class FeatureTests {

        @Test
        @DisplayName("Should report features from an active plan only")
        void shouldReportFeatures() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 5, 10)));

            assertThat(licenseGate.hasFeature(ORG_ID, LicenseFeature.API_ACCESS)).isTrue();
            assertThat(licenseGate.hasFeature(ORG_ID, LicenseFeature.WHITE_LABEL)).isFalse();
            assertThat(licenseGate.hasFeature(ORG_ID, LicenseFeature.UNLIMITED_ASSESSMENTS)).isFalse();
        }

        @Test
        @DisplayName("Should report no features for a lapsed plan")
        void shouldHideFeaturesOfLapsedPlan() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.PAST_DUE, 5, 10)));

            assertThat(licenseGate.hasFeature(ORG_ID, LicenseFeature.API_ACCESS)).isFalse();
        }

        @Test
        @DisplayName("Should summarise usage for the current period")
        void shouldBuildUsageReport() {
            when(planRepository.findByOrganizationId(ORG_ID)).thenReturn(Optional.of(plan(PlanStatus.ACTIVE, 10, 5)));
            when(usageCounterRepository.findByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_RUN, PERIOD)).thenReturn(counter(4));
            when(usageCounterRepository.findByOrganizationIdAndMetricTypeAndBillingPeriod(
                    ORG_ID, UsageMetric.ASSESSMENT_COMPLETED, PERIOD)).thenReturn(counter(3));

            UsageReport report = licenseGate.getUsageReport(ORG_ID);

            assertThat(report.billingPeriod()).isEqualTo(PERIOD);
            assertThat(report.assessmentsStarted()).isEqualTo(4);
            assertThat(report.assessmentsCompleted()).isEqualTo(3);
            assertThat(report.percentUsed()).isEqualTo(40.0);
            assertThat(report.remainingAssessments()).isEqualTo(6L);
        }
    }
}
