package com.microsoft.cloudgovernance.assessment;

import java.util.UUID;

public class AssessmentNotFoundException extends RuntimeException {

    public AssessmentNotFoundException(UUID assessmentId) {
        super("Assessment " + assessmentId + " not found");
    }
}
