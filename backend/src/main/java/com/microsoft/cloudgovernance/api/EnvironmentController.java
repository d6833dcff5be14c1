package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.credential.AccessCheck;
import com.microsoft.cloudgovernance.inventory.ConnectionTestResult;
import com.microsoft.cloudgovernance.inventory.EnvironmentHealthService;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/environments")
@RequiredArgsConstructor
@Tag(name = "Environments", description = "Connectivity checks for Azure environments")
@SecurityRequirement(name = "bearer-jwt")
public class EnvironmentController {

    private final EnvironmentHealthService healthService;

    @PostMapping("/{environmentId}/test-connection")
    @Operation(summary = "Test Resource Graph connectivity",
               description = "Runs a one-row query with the credential an assessment would use")
    public ResponseEntity<ConnectionTestResult> testConnection(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID environmentId
    ) {
        return ResponseEntity.ok(healthService.testEnvironment(Callers.require(context), environmentId));
    }

    @PostMapping("/{environmentId}/credentials/test")
    @Operation(summary = "Test the client's delegated credential")
    public ResponseEntity<AccessCheck> testCredentials(
            @AuthenticationPrincipal AuthenticatedContext context,
            @PathVariable UUID environmentId
    ) {
        return ResponseEntity.ok(healthService.testCredentials(Callers.require(context), environmentId));
    }
}
