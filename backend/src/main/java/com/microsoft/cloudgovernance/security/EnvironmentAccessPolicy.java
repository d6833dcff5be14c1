package com.microsoft.cloudgovernance.security;

import com.microsoft.cloudgovernance.domain.model.AzureEnvironment;
import com.microsoft.cloudgovernance.domain.repository.AzureEnvironmentRepository;
import com.microsoft.cloudgovernance.domain.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Ownership rule for Azure environments.
 *
 * An environment is visible when it is active and belongs to the caller's
 * organization, either directly or through one of the organization's clients.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnvironmentAccessPolicy {

    private final AzureEnvironmentRepository environmentRepository;
    private final ClientRepository clientRepository;

    public AzureEnvironment requireAccessible(AuthenticatedContext context, UUID environmentId) {
        AzureEnvironment environment = environmentRepository.findById(environmentId)
                .filter(AzureEnvironment::isActive)
                .filter(env -> isOwnedBy(env, context.organizationId()))
                .orElseThrow(() -> {
                    log.info("Environment {} not accessible to organization: {}", environmentId, context.organizationId());
                    return new EnvironmentNotFoundException(environmentId);
                });
        return environment;
    }

    private boolean isOwnedBy(AzureEnvironment environment, UUID organizationId) {
        if (organizationId.equals(environment.getOrganizationId())) {
            return true;
        }
        return environment.getClientId() != null
                && clientRepository.existsByIdAndOrganizationId(environment.getClientId(), organizationId);
    }
}
