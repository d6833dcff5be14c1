package com.microsoft.cloudgovernance.credential;

public record AccessCheck(AccessStatus status, String message) {

    public boolean isValid() {
        return status == AccessStatus.VALID;
    }
}
