package com.microsoft.cloudgovernance.domain.model;

public enum LicenseFeature {
    API_ACCESS,
    WHITE_LABEL,
    CUSTOM_BRANDING,
    UNLIMITED_ASSESSMENTS
}
