package com.microsoft.cloudgovernance.domain.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
