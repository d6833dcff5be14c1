package com.microsoft.cloudgovernance.assessment;

/**
 * Operation not allowed in the assessment's current state, e.g. deleting a running run.
 */
public class AssessmentStateException extends RuntimeException {

    public AssessmentStateException(String message) {
        super(message);
    }
}
