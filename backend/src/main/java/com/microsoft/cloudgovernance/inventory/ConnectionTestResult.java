package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.domain.model.CredentialPath;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Outcome of an environment connection test.
 *
 * @param credentialPath credential used for the probe, null when none could be obtained
 */
public record ConnectionTestResult(
        UUID environmentId,
        boolean success,
        CredentialPath credentialPath,
        String message,
        LocalDateTime testedAt
) {}
