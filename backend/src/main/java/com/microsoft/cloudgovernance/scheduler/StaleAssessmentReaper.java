package com.microsoft.cloudgovernance.scheduler;

import com.microsoft.cloudgovernance.assessment.AssessmentOrchestrator;
import com.microsoft.cloudgovernance.domain.model.Assessment;
import com.microsoft.cloudgovernance.domain.model.AssessmentStatus;
import com.microsoft.cloudgovernance.domain.model.FailureReason;
import com.microsoft.cloudgovernance.domain.repository.AssessmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduled job that fails assessments abandoned in PENDING or IN_PROGRESS.
 *
 * A run is abandoned when it is older than the stale threshold and no worker in
 * this instance owns it, typically after a restart mid-run. Such runs are marked
 * FAILED with reason Interrupted so callers polling them see a terminal state.
 */
@Component
@Slf4j
public class StaleAssessmentReaper {

    private final AssessmentRepository assessmentRepository;
    private final AssessmentOrchestrator orchestrator;
    private final Clock clock;
    private final Duration staleAfter;

    public StaleAssessmentReaper(
            AssessmentRepository assessmentRepository,
            AssessmentOrchestrator orchestrator,
            Clock clock,
            @Value("${compass.assessment.stale-after:2h}") Duration staleAfter
    ) {
        this.assessmentRepository = assessmentRepository;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    /**
     * Runs every five minutes by default.
     */
    @Scheduled(cron = "${compass.assessment.reaper-cron:0 */5 * * * *}")
    public void reapStaleAssessments() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Assessment> candidates = assessmentRepository.findStaleAssessments(
                List.of(AssessmentStatus.PENDING, AssessmentStatus.IN_PROGRESS),
                now.minus(staleAfter));
        if (candidates.isEmpty()) {
            return;
        }
        log.info("Found {} assessments older than {} without a terminal state", candidates.size(), staleAfter);

        int reaped = 0;
        int skipped = 0;
        for (Assessment assessment : candidates) {
            if (orchestrator.isRunning(assessment.getId())) {
                skipped++;
                continue;
            }
            try {
                assessment.fail(FailureReason.INTERRUPTED,
                        "Run was abandoned in " + assessment.getStatus() + " and never finished", now);
                assessmentRepository.save(assessment);
                reaped++;
            } catch (Exception e) {
                log.error("Failed to reap assessment {}: {}", assessment.getId(), e.getMessage());
            }
        }

        log.info("Stale assessment sweep complete: {} failed as interrupted, {} still running", reaped, skipped);
    }
}
