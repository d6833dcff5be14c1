package com.microsoft.cloudgovernance.domain.model;

/**
 * Rough remediation effort attached to a finding.
 */
public enum EffortLevel {
    LOW,
    MEDIUM,
    HIGH
}
