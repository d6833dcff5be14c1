package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.credential.AccessCheck;
import com.microsoft.cloudgovernance.credential.AccessStatus;
import com.microsoft.cloudgovernance.credential.CredentialResolution;
import com.microsoft.cloudgovernance.credential.CredentialResolver;
import com.microsoft.cloudgovernance.credential.CredentialVault;
import com.microsoft.cloudgovernance.domain.model.AzureEnvironment;
import com.microsoft.cloudgovernance.domain.repository.AzureEnvironmentRepository;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import com.microsoft.cloudgovernance.security.EnvironmentAccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Connectivity and credential checks for an environment, outside of any assessment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnvironmentHealthService {

    private final EnvironmentAccessPolicy accessPolicy;
    private final AzureEnvironmentRepository environmentRepository;
    private final CredentialResolver credentialResolver;
    private final CredentialVault credentialVault;
    private final ResourceInventoryFetcher inventoryFetcher;
    private final Clock clock;

    /**
     * Probe Resource Graph with the environment's credential and record the outcome on the environment.
     */
    public ConnectionTestResult testEnvironment(AuthenticatedContext context, UUID environmentId) {
        AzureEnvironment environment = accessPolicy.requireAccessible(context, environmentId);
        LocalDateTime testedAt = LocalDateTime.now(clock);

        CredentialResolution resolution = credentialResolver.resolve(environment.getOrganizationId(),
                environment.getClientId());
        ConnectionTestResult result;
        if (!resolution.isResolved()) {
            String message = resolution.delegated() != null
                    ? resolution.delegated().remediation()
                    : "Platform identity is not available";
            result = new ConnectionTestResult(environmentId, false, null, message, testedAt);
        } else if (environment.getSubscriptionIds().isEmpty()) {
            result = new ConnectionTestResult(environmentId, false, resolution.path(),
                    "Environment has no subscriptions", testedAt);
        } else {
            boolean connected = inventoryFetcher.testConnection(environment.getSubscriptionIds(), resolution.credential());
            result = new ConnectionTestResult(environmentId, connected, resolution.path(),
                    connected ? "Resource Graph reachable" : "Resource Graph query failed; check the Reader role assignment",
                    testedAt);
        }

        environment.recordConnectionTest(result.success(), result.message(), testedAt);
        environmentRepository.save(environment);
        log.info("Connection test for environment {}: {} via {}", environmentId,
                result.success() ? "ok" : "failed", result.credentialPath());
        return result;
    }

    /**
     * Check the client's delegated credential against the environment's first subscription.
     */
    public AccessCheck testCredentials(AuthenticatedContext context, UUID environmentId) {
        AzureEnvironment environment = accessPolicy.requireAccessible(context, environmentId);
        if (environment.getClientId() == null) {
            return new AccessCheck(AccessStatus.NO_CREDENTIALS,
                    "Environment has no client; assessments use the platform identity");
        }
        if (environment.getSubscriptionIds().isEmpty()) {
            return new AccessCheck(AccessStatus.INSUFFICIENT_PERMISSION, "Environment has no subscriptions");
        }
        return credentialVault.testAccess(environment.getClientId(), environment.getOrganizationId(),
                environment.getSubscriptionIds().get(0));
    }
}
