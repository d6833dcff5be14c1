package com.microsoft.cloudgovernance.assessment;

import com.microsoft.cloudgovernance.licensing.Admission;

/**
 * The license gate refused to start an assessment. No assessment was created.
 */
public class AdmissionDeniedException extends RuntimeException {

    private final Admission admission;

    public AdmissionDeniedException(Admission admission) {
        super(admission.message() != null ? admission.message() : admission.reasonCode());
        this.admission = admission;
    }

    public Admission getAdmission() {
        return admission;
    }
}
