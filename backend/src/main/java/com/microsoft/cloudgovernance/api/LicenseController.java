package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.assessment.AssessmentOrchestrator;
import com.microsoft.cloudgovernance.domain.model.LicenseFeature;
import com.microsoft.cloudgovernance.licensing.Admission;
import com.microsoft.cloudgovernance.licensing.LicenseGate;
import com.microsoft.cloudgovernance.licensing.UsageReport;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Plan usage for the caller's organization, plus the admin-only bulk cancel.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "License", description = "Plan usage and feature flags")
@SecurityRequirement(name = "bearer-jwt")
public class LicenseController {

    private final LicenseGate licenseGate;
    private final AssessmentOrchestrator orchestrator;

    @GetMapping("/api/license/usage")
    @Operation(summary = "Usage for the current billing period")
    public ResponseEntity<UsageReport> getUsage(@AuthenticationPrincipal AuthenticatedContext context) {
        return ResponseEntity.ok(licenseGate.getUsageReport(Callers.require(context).organizationId()));
    }

    @GetMapping("/api/license/admission")
    @Operation(summary = "Whether another assessment may start", description = "Does not reserve anything")
    public ResponseEntity<Admission> checkAdmission(@AuthenticationPrincipal AuthenticatedContext context) {
        return ResponseEntity.ok(licenseGate.canStartAssessment(Callers.require(context).organizationId()));
    }

    @GetMapping("/api/license/features/{feature}")
    @Operation(summary = "Check a plan feature")
    public ResponseEntity<FeatureResponse> hasFeature(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable LicenseFeature feature
    ) {
        boolean enabled = licenseGate.hasFeature(Callers.require(context).organizationId(), feature);
        return ResponseEntity.ok(new FeatureResponse(feature, enabled));
    }

    @PostMapping("/api/admin/organizations/{organizationId}/assessments/cancel")
    @Operation(summary = "Cancel all active assessments of an organization")
    public ResponseEntity<BulkCancelResponse> cancelOrganizationAssessments(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID organizationId
    ) {
        AuthenticatedContext caller = Callers.require(context);
        if (!caller.hasRole("ROLE_ADMIN")) {
            throw new AccessDeniedException("Admin role required");
        }
        log.info("Admin {} cancelling assessments of organization: {}", caller.customerId(), organizationId);
        int cancelled = orchestrator.cancelOrganizationAssessments(organizationId);
        return ResponseEntity.ok(new BulkCancelResponse(organizationId, cancelled));
    }

    public record FeatureResponse(LicenseFeature feature, boolean enabled) {}

    public record BulkCancelResponse(UUID organizationId, int cancelled) {}
}
