package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.analysis.*;
import com.microsoft.cloudgovernance.credential.CredentialResolution;
import com.microsoft.cloudgovernance.credential.CredentialResolver;
import com.microsoft.cloudgovernance.credential.TokenResult;
import com.microsoft.cloudgovernance.credential.TokenStatus;
import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.AssessmentRepository;
import com.microsoft.cloudgovernance.domain.repository.AzureEnvironmentRepository;
import com.microsoft.cloudgovernance.inventory.CancellationSignal;
import com.microsoft.cloudgovernance.inventory.InventoryFetchResult;
import com.microsoft.cloudgovernance.inventory.ResourceInventoryFetcher;
import com.microsoft.cloudgovernance.licensing.LicenseGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.CancellationException;

/**
 * Executes the assessment pipeline for one assessment on a worker thread.
 *
 * PIPELINE:
 * 1. Mark IN_PROGRESS
 * 2. Load the environment
 * 3. Resolve a credential (delegated, falling back to the platform identity)
 * 4. Fetch inventory; retry once on the platform identity when every
 *    subscription rejected the delegated token
 * 5. Record inventory counts (and the snapshot when requested)
 * 6. Run the analyzers for the assessment type
 * 7. Write findings
 * 8. Aggregate scores and mark COMPLETED
 *
 * Each stage returns a StageResult; the first failure ends the run as FAILED
 * with that stage's reason. Whatever happens, the assessment is terminal when
 * run() returns.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssessmentRunner {

    private final AssessmentRepository assessmentRepository;
    private final AzureEnvironmentRepository environmentRepository;
    private final CredentialResolver credentialResolver;
    private final ResourceInventoryFetcher inventoryFetcher;
    private final Map<AnalyzerKind, PolicyAnalyzer> analyzers;
    private final PolicyPreferencesService preferencesService;
    private final ScoreAggregator scoreAggregator;
    private final FindingsStore findingsStore;
    private final LicenseGate licenseGate;
    private final Clock clock;

    public void run(UUID assessmentId, CancellationSignal signal) {
        log.info("Starting assessment pipeline for {}", assessmentId);
        try {
            StageResult<Assessment> outcome = executeStages(assessmentId, signal);
            if (outcome.isSuccess()) {
                log.info("Assessment {} completed with score {}", assessmentId, outcome.getValue().getOverallScore());
            } else {
                failRun(assessmentId, outcome.getFailureReason(), outcome.getDetail());
            }
        } catch (CancellationException e) {
            log.info("Assessment {} cancelled", assessmentId);
            failRun(assessmentId, FailureReason.CANCELLED, "Cancelled by request");
        } catch (RuntimeException e) {
            log.error("Assessment {} failed unexpectedly", assessmentId, e);
            failRun(assessmentId, FailureReason.INTERNAL_ERROR, e.getMessage());
        } finally {
            guaranteeTerminal(assessmentId);
        }
    }

    private StageResult<Assessment> executeStages(UUID assessmentId, CancellationSignal signal) {
        signal.throwIfCancelled();
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new IllegalStateException("Assessment " + assessmentId + " disappeared before it ran"));
        if (assessment.isTerminal()) {
            log.info("Assessment {} is already {}; nothing to run", assessmentId, assessment.getStatus());
            return StageResult.success(assessment);
        }
        assessment.markInProgress(now());
        assessment = assessmentRepository.save(assessment);

        StageResult<AzureEnvironment> environment = loadEnvironment(assessment);
        if (!environment.isSuccess()) {
            return environment.propagate();
        }
        signal.throwIfCancelled();

        StageResult<CredentialResolution> credential = resolveCredential(assessment, environment.getValue());
        if (!credential.isSuccess()) {
            return credential.propagate();
        }
        assessment.recordCredentialPath(credential.getValue().path());
        assessment = assessmentRepository.save(assessment);
        signal.throwIfCancelled();

        StageResult<FetchedInventory> inventory =
                fetchInventory(assessment, environment.getValue(), credential.getValue(), signal);
        if (!inventory.isSuccess()) {
            return inventory.propagate();
        }
        signal.throwIfCancelled();

        StageResult<Assessment> stored = storeInventory(assessment, inventory.getValue());
        if (!stored.isSuccess()) {
            return stored;
        }
        assessment = stored.getValue();

        StageResult<Map<AnalyzerKind, AnalysisResult>> analysis =
                analyze(assessment, inventory.getValue().result().resources());
        if (!analysis.isSuccess()) {
            return analysis.propagate();
        }
        signal.throwIfCancelled();

        StageResult<Integer> findings = persistFindings(assessment, analysis.getValue());
        if (!findings.isSuccess()) {
            return findings.propagate();
        }

        return complete(assessment, analysis.getValue());
    }

    private StageResult<AzureEnvironment> loadEnvironment(Assessment assessment) {
        return environmentRepository.findById(assessment.getEnvironmentId())
                .filter(AzureEnvironment::isActive)
                .map(StageResult::success)
                .orElseGet(() -> StageResult.failure(FailureReason.ENVIRONMENT_NOT_FOUND,
                        "Environment " + assessment.getEnvironmentId() + " no longer exists or is inactive"));
    }

    private StageResult<CredentialResolution> resolveCredential(Assessment assessment, AzureEnvironment environment) {
        CredentialResolution resolution =
                credentialResolver.resolve(assessment.getOrganizationId(), assessment.getClientId());

        TokenResult delegated = resolution.delegated();
        if (delegated != null) {
            if (delegated.isValid()) {
                recordCredentialHealth(environment, CredentialStatus.VALID, null);
            } else {
                recordCredentialHealth(environment,
                        delegated.status() == TokenStatus.UNAVAILABLE ? CredentialStatus.UNKNOWN : CredentialStatus.INVALID,
                        delegated.remediation());
            }
        }

        if (resolution.isResolved()) {
            log.info("Assessment {} using credential path {}", assessment.getId(), resolution.path());
            return StageResult.success(resolution);
        }

        TokenResult platform = resolution.platform();
        if (delegated != null && delegated.status() == TokenStatus.INVALID) {
            return StageResult.failure(FailureReason.CREDENTIAL_INVALID, delegated.remediation());
        }
        if (isUnavailable(delegated) || isUnavailable(platform)) {
            return StageResult.failure(FailureReason.IDENTITY_PROVIDER_UNAVAILABLE,
                    remediationOf(delegated, platform));
        }
        return StageResult.failure(FailureReason.CREDENTIAL_MISSING, remediationOf(delegated, platform));
    }

    private StageResult<FetchedInventory> fetchInventory(
            Assessment assessment,
            AzureEnvironment environment,
            CredentialResolution resolution,
            CancellationSignal signal
    ) {
        List<String> subscriptions = splitSubscriptions(assessment.getSubscriptionIds());
        InventoryFetchResult result = inventoryFetcher.fetchResources(subscriptions, resolution.credential(), signal);
        CredentialPath path = resolution.path();

        if (result.allFailed() && result.allFailuresAreAuthorization() && path == CredentialPath.DELEGATED_OAUTH) {
            log.warn("Every subscription rejected the delegated token for assessment {}; trying platform identity",
                    assessment.getId());
            String remediation = "Delegated token was rejected by Azure Resource Manager; re-authenticate the client";
            recordCredentialHealth(environment, CredentialStatus.INVALID, remediation);
            CredentialResolution fallback = credentialResolver.fallback(TokenResult.invalid(remediation));
            if (fallback.isResolved()) {
                signal.throwIfCancelled();
                result = inventoryFetcher.fetchResources(subscriptions, fallback.credential(), signal);
                path = fallback.path();
            }
        }

        if (result.allFailed()) {
            FailureReason reason = result.anyAuthorizationFailure()
                    ? FailureReason.INSUFFICIENT_PERMISSION
                    : FailureReason.PROVIDER_UNAVAILABLE;
            return StageResult.failure(reason, "No subscription could be read: " + result.failureSummary());
        }
        if (result.hasFailures()) {
            log.warn("Assessment {} continues with partial inventory; failed subscriptions: {}",
                    assessment.getId(), result.failureSummary());
        }
        return StageResult.success(new FetchedInventory(result, path));
    }

    private StageResult<Assessment> storeInventory(Assessment assessment, FetchedInventory inventory) {
        InventoryFetchResult result = inventory.result();
        try {
            if (inventory.path() != assessment.getCredentialPath()) {
                assessment.recordCredentialPath(inventory.path());
            }
            assessment.recordInventory(result.resources().size(), result.failureSummary());
            Assessment saved = assessmentRepository.save(assessment);
            if (saved.isCaptureInventory()) {
                findingsStore.storeResources(saved.getId(), result.resources());
            }
            return StageResult.success(saved);
        } catch (DataAccessException e) {
            log.error("Could not store inventory for assessment {}", assessment.getId(), e);
            return StageResult.failure(FailureReason.PERSISTENCE_ERROR, "Could not store inventory: " + e.getMessage());
        }
    }

    private StageResult<Map<AnalyzerKind, AnalysisResult>> analyze(Assessment assessment,
                                                                    List<ResourceSnapshot> resources) {
        PolicyPreferences preferences;
        try {
            preferences = assessment.isUseClientPreferences() && assessment.getClientId() != null
                    ? preferencesService.resolve(assessment.getClientId(), assessment.getOrganizationId())
                    : PolicyPreferences.defaults();
        } catch (DataAccessException e) {
            log.error("Could not load preferences for assessment {}", assessment.getId(), e);
            return StageResult.failure(FailureReason.PERSISTENCE_ERROR, "Could not load client preferences");
        }

        Map<AnalyzerKind, AnalysisResult> results = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerKind kind : assessment.getAssessmentType().getAnalyzers()) {
            PolicyAnalyzer analyzer = analyzers.get(kind);
            if (analyzer == null) {
                return StageResult.failure(FailureReason.ANALYZER_ERROR, "No analyzer registered for " + kind);
            }
            try {
                AnalysisResult result = analyzer.analyze(resources, preferences);
                log.info("{} analysis for assessment {}: score {}, {} violations, {} skipped",
                        kind, assessment.getId(), result.score(), result.violations().size(), result.skipped().size());
                results.put(kind, result);
            } catch (RuntimeException e) {
                log.error("{} analyzer failed for assessment {}", kind, assessment.getId(), e);
                return StageResult.failure(FailureReason.ANALYZER_ERROR, kind + " analysis failed: " + e.getMessage());
            }
        }
        return StageResult.success(results);
    }

    private StageResult<Integer> persistFindings(Assessment assessment, Map<AnalyzerKind, AnalysisResult> results) {
        List<Violation> violations = new ArrayList<>();
        List<SkippedResource> skipped = new ArrayList<>();
        results.values().forEach(result -> {
            violations.addAll(result.violations());
            skipped.addAll(result.skipped());
        });
        try {
            return StageResult.success(findingsStore.storeFindings(assessment.getId(), violations, skipped));
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Could not store findings for assessment {}", assessment.getId(), e);
            return StageResult.failure(FailureReason.PERSISTENCE_ERROR, "Could not store findings: " + e.getMessage());
        }
    }

    private StageResult<Assessment> complete(Assessment assessment, Map<AnalyzerKind, AnalysisResult> results) {
        Map<AnalyzerKind, BigDecimal> scores = new EnumMap<>(AnalyzerKind.class);
        results.forEach((kind, result) -> scores.put(kind, result.score()));
        BigDecimal overall = scoreAggregator.aggregate(scores);

        Assessment saved;
        try {
            assessment.complete(overall, scores, now());
            saved = assessmentRepository.save(assessment);
        } catch (DataAccessException e) {
            log.error("Could not complete assessment {}", assessment.getId(), e);
            return StageResult.failure(FailureReason.PERSISTENCE_ERROR, "Could not save results: " + e.getMessage());
        }

        try {
            licenseGate.recordUsage(saved.getOrganizationId(), UsageMetric.ASSESSMENT_COMPLETED);
        } catch (RuntimeException e) {
            log.warn("Could not record completed usage for organization: {}: {}",
                    saved.getOrganizationId(), e.getMessage());
        }
        return StageResult.success(saved);
    }

    private void failRun(UUID assessmentId, FailureReason reason, String detail) {
        try {
            Assessment assessment = assessmentRepository.findById(assessmentId).orElse(null);
            if (assessment == null || assessment.isTerminal()) {
                return;
            }
            assessment.fail(reason, detail, now());
            assessmentRepository.save(assessment);
            log.warn("Assessment {} failed: {} ({})", assessmentId, reason.getCode(), detail);
        } catch (RuntimeException e) {
            log.error("Could not mark assessment {} as failed with {}", assessmentId, reason, e);
        }
    }

    /**
     * Last line of defense: nothing leaves a run in PENDING or IN_PROGRESS.
     */
    private void guaranteeTerminal(UUID assessmentId) {
        try {
            Assessment assessment = assessmentRepository.findById(assessmentId).orElse(null);
            if (assessment != null && !assessment.isTerminal()) {
                assessment.fail(FailureReason.INTERNAL_ERROR, "Pipeline ended without reaching a terminal state", now());
                assessmentRepository.save(assessment);
                log.error("Assessment {} was left {}; marked FAILED", assessmentId, assessment.getStatus());
            }
        } catch (RuntimeException e) {
            log.error("Could not verify terminal state of assessment {}", assessmentId, e);
        }
    }

    private void recordCredentialHealth(AzureEnvironment environment, CredentialStatus status, String remediation) {
        if (environment.getCredentialStatus() == status && Objects.equals(environment.getCredentialRemediation(), remediation)) {
            return;
        }
        try {
            environment.recordCredentialHealth(status, remediation);
            environmentRepository.save(environment);
        } catch (DataAccessException e) {
            log.warn("Could not record credential health for environment {}: {}", environment.getId(), e.getMessage());
        }
    }

    static List<String> splitSubscriptions(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static boolean isUnavailable(TokenResult result) {
        return result != null && result.status() == TokenStatus.UNAVAILABLE;
    }

    private static String remediationOf(TokenResult delegated, TokenResult platform) {
        if (delegated != null && delegated.remediation() != null) {
            return delegated.remediation();
        }
        return platform != null ? platform.remediation() : "No credential available for this environment";
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record FetchedInventory(InventoryFetchResult result, CredentialPath path) {}
}
