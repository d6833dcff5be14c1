package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.AssessmentRepository;
import com.microsoft.cloudgovernance.inventory.CancellationSignal;
import com.microsoft.cloudgovernance.licensing.Admission;
import com.microsoft.cloudgovernance.licensing.LicenseGate;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import com.microsoft.cloudgovernance.security.EnvironmentAccessPolicy;
import com.microsoft.cloudgovernance.security.EnvironmentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for starting, inspecting, cancelling and deleting assessments.
 *
 * START FLOW:
 * 1. Environment must be visible to the caller's organization
 * 2. Requested subscriptions must belong to the environment
 * 3. License gate admits the run and counts it (atomically)
 * 4. Assessment row is created in PENDING and the pipeline is handed to the
 *    assessment executor; the call returns without waiting for it
 *
 * Every read is scoped to the caller's organization. An assessment owned by
 * another organization is reported as not found.
 */
@Service
@Slf4j
public class AssessmentOrchestrator {

    private static final DateTimeFormatter NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final AssessmentRepository assessmentRepository;
    private final EnvironmentAccessPolicy accessPolicy;
    private final LicenseGate licenseGate;
    private final AssessmentRunner runner;
    private final FindingsStore findingsStore;
    private final TaskExecutor assessmentExecutor;
    private final Clock clock;

    private final Map<UUID, RunningAssessment> running = new ConcurrentHashMap<>();

    public AssessmentOrchestrator(
            AssessmentRepository assessmentRepository,
            EnvironmentAccessPolicy accessPolicy,
            LicenseGate licenseGate,
            AssessmentRunner runner,
            FindingsStore findingsStore,
            @Qualifier("assessmentExecutor") TaskExecutor assessmentExecutor,
            Clock clock
    ) {
        this.assessmentRepository = assessmentRepository;
        this.accessPolicy = accessPolicy;
        this.licenseGate = licenseGate;
        this.runner = runner;
        this.findingsStore = findingsStore;
        this.assessmentExecutor = assessmentExecutor;
        this.clock = clock;
    }

    /**
     * Admit and schedule a new assessment.
     *
     * @return the PENDING assessment
     * @throws EnvironmentNotFoundException if the environment is not visible to the caller
     * @throws InvalidAssessmentRequestException if the subscription selection is invalid
     * @throws AdmissionDeniedException if the plan does not allow another run
     */
    public AssessmentStatusView startAssessment(AuthenticatedContext context, StartAssessmentRequest request) {
        AzureEnvironment environment = accessPolicy.requireAccessible(context, request.environmentId());
        if (request.clientId() != null && !request.clientId().equals(environment.getClientId())) {
            log.info("Client {} does not own environment {}", request.clientId(), environment.getId());
            throw new EnvironmentNotFoundException(environment.getId());
        }
        List<String> subscriptions = selectSubscriptions(environment, request.subscriptionIds());

        Admission admission = licenseGate.reserveAssessment(context.organizationId(), subscriptions.size());
        if (!admission.allowed()) {
            throw new AdmissionDeniedException(admission);
        }

        AssessmentOptions options = request.effectiveOptions();
        Assessment assessment;
        try {
            assessment = assessmentRepository.save(Assessment.builder()
                    .id(UUID.randomUUID())
                    .organizationId(context.organizationId())
                    .customerId(context.customerId())
                    .clientId(environment.getClientId())
                    .environmentId(environment.getId())
                    .name(nameFor(options, environment, request.type()))
                    .assessmentType(request.type())
                    .status(AssessmentStatus.PENDING)
                    .subscriptionIds(String.join(",", subscriptions))
                    .useClientPreferences(request.useClientPreferences())
                    .captureInventory(options.captureInventory())
                    .createdAt(LocalDateTime.now(clock))
                    .build());
        } catch (RuntimeException e) {
            log.error("Could not create assessment for environment {} in organization: {}; releasing reserved usage",
                    environment.getId(), context.organizationId(), e);
            try {
                licenseGate.releaseAssessment(context.organizationId());
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        log.info("Assessment {} ({}) created for environment {} in organization: {} ({} subscriptions)",
                assessment.getId(), request.type(), environment.getId(), context.organizationId(), subscriptions.size());
        dispatch(assessment);
        return AssessmentStatusView.from(assessment);
    }

    @Transactional(readOnly = true)
    public AssessmentStatusView getStatus(AuthenticatedContext context, UUID assessmentId) {
        return AssessmentStatusView.from(load(context, assessmentId));
    }

    /**
     * Scores and finding counts of a completed assessment.
     *
     * @throws AssessmentNotReadyException if the assessment is not COMPLETED
     */
    @Transactional(readOnly = true)
    public AssessmentResultView getResult(AuthenticatedContext context, UUID assessmentId) {
        Assessment assessment = load(context, assessmentId);
        if (assessment.getStatus() != AssessmentStatus.COMPLETED) {
            throw new AssessmentNotReadyException(assessmentId, assessment.getStatus(), assessment.getFailureReason());
        }
        Map<Severity, Long> bySeverity = findingsStore.countBySeverity(assessmentId);
        long total = bySeverity.values().stream().mapToLong(Long::longValue).sum();
        Map<AnalyzerKind, BigDecimal> scores = new EnumMap<>(AnalyzerKind.class);
        scores.putAll(assessment.getAnalyzerScores());
        return new AssessmentResultView(
                assessment.getId(),
                assessment.getName(),
                assessment.getAssessmentType(),
                assessment.getOverallScore(),
                scores,
                assessment.getResourceCount(),
                total,
                bySeverity,
                assessment.getCredentialPath(),
                assessment.getFailedSubscriptions(),
                assessment.getCompletedAt()
        );
    }

    @Transactional(readOnly = true)
    public Page<FindingView> getFindings(AuthenticatedContext context, UUID assessmentId,
                                         FindingFilter filter, Pageable pageable) {
        load(context, assessmentId);
        return findingsStore.findFindings(assessmentId, filter, pageable).map(FindingView::from);
    }

    @Transactional(readOnly = true)
    public Page<ResourceSnapshot> getResources(AuthenticatedContext context, UUID assessmentId, Pageable pageable) {
        load(context, assessmentId);
        return findingsStore.findResources(assessmentId, pageable);
    }

    @Transactional(readOnly = true)
    public Page<AssessmentStatusView> listAssessments(AuthenticatedContext context, Pageable pageable) {
        return assessmentRepository.findByOrganizationIdOrderByCreatedAtDesc(context.organizationId(), pageable)
                .map(AssessmentStatusView::from);
    }

    /**
     * Delete a finished assessment with its findings and inventory.
     *
     * @throws AssessmentStateException if the assessment is still pending or running
     */
    @Transactional
    public void deleteAssessment(AuthenticatedContext context, UUID assessmentId) {
        Assessment assessment = load(context, assessmentId);
        if (!assessment.isTerminal() || running.containsKey(assessmentId)) {
            throw new AssessmentStateException(
                    "Assessment " + assessmentId + " is " + assessment.getStatus() + "; cancel it before deleting");
        }
        findingsStore.deleteAll(assessmentId);
        assessmentRepository.delete(assessment);
        log.info("Assessment {} deleted by customer: {}", assessmentId, context.customerId());
    }

    /**
     * Request cancellation of a pending or running assessment.
     *
     * A run owned by this instance stops at its next checkpoint and ends FAILED/Cancelled.
     * A non-terminal run with no live worker (e.g. after a restart) is failed directly.
     *
     * @return true if a cancellation was issued, false if the assessment was already terminal
     */
    public boolean cancelAssessment(AuthenticatedContext context, UUID assessmentId) {
        Assessment assessment = load(context, assessmentId);
        if (assessment.isTerminal()) {
            return false;
        }
        RunningAssessment run = running.get(assessmentId);
        if (run != null) {
            run.signal().cancel();
            log.info("Cancellation requested for assessment {} by customer: {}", assessmentId, context.customerId());
            return true;
        }
        assessment.fail(FailureReason.CANCELLED, "Cancelled by request", LocalDateTime.now(clock));
        assessmentRepository.save(assessment);
        log.info("Assessment {} had no live worker; marked cancelled", assessmentId);
        return true;
    }

    /**
     * Cancel every pending or running assessment of an organization, e.g. when its plan is terminated.
     *
     * @return number of assessments cancelled
     */
    public int cancelOrganizationAssessments(UUID organizationId) {
        int cancelled = 0;
        for (Assessment assessment : assessmentRepository.findByOrganizationIdAndStatusIn(
                organizationId, List.of(AssessmentStatus.PENDING, AssessmentStatus.IN_PROGRESS))) {
            RunningAssessment run = running.get(assessment.getId());
            try {
                if (run != null) {
                    run.signal().cancel();
                } else {
                    assessment.fail(FailureReason.CANCELLED, "Organization assessments cancelled", LocalDateTime.now(clock));
                    assessmentRepository.save(assessment);
                }
                cancelled++;
            } catch (RuntimeException e) {
                log.error("Failed to cancel assessment {}: {}", assessment.getId(), e.getMessage());
            }
        }
        log.info("Cancelled {} assessments for organization: {}", cancelled, organizationId);
        return cancelled;
    }

    /**
     * Whether this instance has a live worker for the assessment.
     */
    public boolean isRunning(UUID assessmentId) {
        return running.containsKey(assessmentId);
    }

    private void dispatch(Assessment assessment) {
        UUID id = assessment.getId();
        CancellationSignal signal = new CancellationSignal();
        running.put(id, new RunningAssessment(signal, assessment.getOrganizationId()));
        try {
            assessmentExecutor.execute(() -> {
                try {
                    runner.run(id, signal);
                } finally {
                    running.remove(id);
                }
            });
        } catch (TaskRejectedException e) {
            running.remove(id);
            log.error("Assessment executor rejected assessment {}", id, e);
            assessment.fail(FailureReason.INTERNAL_ERROR, "Assessment queue is full; retry later", LocalDateTime.now(clock));
            assessmentRepository.save(assessment);
        }
    }

    private List<String> selectSubscriptions(AzureEnvironment environment, List<String> requested) {
        List<String> available = environment.getSubscriptionIds();
        if (requested == null || requested.isEmpty()) {
            if (available.isEmpty()) {
                throw new InvalidAssessmentRequestException(
                        "Environment " + environment.getId() + " has no subscriptions to assess");
            }
            return List.copyOf(available);
        }

        Map<String, String> byLowerCase = new LinkedHashMap<>();
        available.forEach(id -> byLowerCase.put(id.toLowerCase(Locale.ROOT), id));

        Set<String> selected = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String id : requested) {
            if (id == null || id.isBlank()) {
                continue;
            }
            String match = byLowerCase.get(id.trim().toLowerCase(Locale.ROOT));
            if (match == null) {
                unknown.add(id);
            } else {
                selected.add(match);
            }
        }
        if (!unknown.isEmpty()) {
            throw new InvalidAssessmentRequestException(
                    "Subscriptions not part of environment " + environment.getId() + ": " + String.join(", ", unknown));
        }
        if (selected.isEmpty()) {
            throw new InvalidAssessmentRequestException("No subscriptions selected");
        }
        return List.copyOf(selected);
    }

    private Assessment load(AuthenticatedContext context, UUID assessmentId) {
        return assessmentRepository.findByIdAndOrganizationId(assessmentId, context.organizationId())
                .orElseThrow(() -> new AssessmentNotFoundException(assessmentId));
    }

    private String nameFor(AssessmentOptions options, AzureEnvironment environment, AssessmentType type) {
        if (options.name() != null && !options.name().isBlank()) {
            return options.name().trim();
        }
        return environment.getName() + " " + type + " " + LocalDateTime.now(clock).format(NAME_TIMESTAMP);
    }

    private record RunningAssessment(CancellationSignal signal, UUID organizationId) {}
}
