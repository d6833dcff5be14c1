package com.microsoft.cloudgovernance.assessment;

public class InvalidAssessmentRequestException extends RuntimeException {

    public InvalidAssessmentRequestException(String message) {
        super(message);
    }
}
