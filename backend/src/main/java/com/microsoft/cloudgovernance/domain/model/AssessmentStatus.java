package com.microsoft.cloudgovernance.domain.model;

/**
 * Lifecycle of an assessment run.
 *
 * PENDING -> IN_PROGRESS -> COMPLETED | FAILED. Terminal states never change.
 */
public enum AssessmentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
