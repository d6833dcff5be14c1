package com.microsoft.cloudgovernance.domain.model;

public enum FindingCategory {
    NAMING,
    TAGGING,
    DATA_QUALITY
}
