package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.assessment.*;
import com.microsoft.cloudgovernance.domain.model.FindingCategory;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;
import com.microsoft.cloudgovernance.domain.model.Severity;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for governance assessments.
 *
 * ENDPOINT DESIGN:
 * - POST returns 202 with the PENDING assessment; clients poll the status endpoint
 * - Result, findings and resources are only served for the caller's organization
 * - Result of an unfinished assessment is a 409 carrying the current status
 */
@RestController
@RequestMapping("/api/assessments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Assessments", description = "Start and inspect governance assessments")
@SecurityRequirement(name = "bearer-jwt")
public class AssessmentController {

    private static final int MAX_PAGE_SIZE = 500;

    private final AssessmentOrchestrator orchestrator;

    @PostMapping
    @Operation(summary = "Start an assessment",
               description = "Admits the run against the plan and starts it in the background")
    public ResponseEntity<AssessmentStatusView> startAssessment(
            @AuthenticationPrincipal AuthenticatedContext context,
            @Valid @RequestBody StartAssessmentRequest request
    ) {
        AuthenticatedContext caller = Callers.require(context);
        log.info("Assessment start request: environment={}, type={}", request.environmentId(), request.type());
        return ResponseEntity.accepted().body(orchestrator.startAssessment(caller, request));
    }

    @GetMapping
    @Operation(summary = "List assessments", description = "Most recent first")
    public ResponseEntity<PageResponse<AssessmentStatusView>> listAssessments(
            @AuthenticationPrincipal AuthenticatedContext context,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        Page<AssessmentStatusView> result = orchestrator.listAssessments(Callers.require(context),
                PageRequest.of(Math.max(page, 0), clampSize(size)));
        return ResponseEntity.ok(PageResponse.of(result));
    }

    @GetMapping("/{assessmentId}")
    @Operation(summary = "Get assessment status")
    public ResponseEntity<AssessmentStatusView> getStatus(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId
    ) {
        return ResponseEntity.ok(orchestrator.getStatus(Callers.require(context), assessmentId));
    }

    @GetMapping("/{assessmentId}/result")
    @Operation(summary = "Get assessment result",
               description = "Scores and finding counts; 409 until the assessment has completed")
    public ResponseEntity<AssessmentResultView> getResult(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId
    ) {
        return ResponseEntity.ok(orchestrator.getResult(Callers.require(context), assessmentId));
    }

    @GetMapping("/{assessmentId}/findings")
    @Operation(summary = "List findings", description = "Optionally filtered by category and severity")
    public ResponseEntity<PageResponse<FindingView>> getFindings(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId,
            @RequestParam(required = false) FindingCategory category,
            @RequestParam(required = false) Severity severity,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        Page<FindingView> findings = orchestrator.getFindings(
                Callers.require(context),
                assessmentId,
                new FindingFilter(category, severity),
                PageRequest.of(Math.max(page, 0), clampSize(size), Sort.by("id")));
        return ResponseEntity.ok(PageResponse.of(findings));
    }

    @GetMapping("/{assessmentId}/resources")
    @Operation(summary = "List captured inventory")
    public ResponseEntity<PageResponse<ResourceSnapshot>> getResources(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size
    ) {
        Page<ResourceSnapshot> resources = orchestrator.getResources(Callers.require(context), assessmentId,
                PageRequest.of(Math.max(page, 0), clampSize(size), Sort.by("id")));
        return ResponseEntity.ok(PageResponse.of(resources));
    }

    @PostMapping("/{assessmentId}/cancel")
    @Operation(summary = "Cancel an assessment")
    public ResponseEntity<CancelResponse> cancelAssessment(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId
    ) {
        boolean cancelled = orchestrator.cancelAssessment(Callers.require(context), assessmentId);
        return ResponseEntity.accepted().body(new CancelResponse(assessmentId, cancelled));
    }

    @DeleteMapping("/{assessmentId}")
    @Operation(summary = "Delete a finished assessment")
    public ResponseEntity<Void> deleteAssessment(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID assessmentId
    ) {
        orchestrator.deleteAssessment(Callers.require(context), assessmentId);
        return ResponseEntity.noContent().build();
    }

    private static int clampSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }

    // ============================================================================
    // Response DTOs
    // ============================================================================

    public record CancelResponse(UUID assessmentId, boolean cancellationIssued) {}

    public record PageResponse<T>(
            List<T> content,
            int page,
            int size,
            long totalElements,
            int totalPages
    ) {
        static <T> PageResponse<T> of(Page<T> page) {
            return new PageResponse<>(page.getContent(), page.getNumber(), page.getSize(),
                    page.getTotalElements(), page.getTotalPages());
        }
    }
}
