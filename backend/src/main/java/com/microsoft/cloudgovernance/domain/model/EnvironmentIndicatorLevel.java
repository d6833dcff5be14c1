package com.microsoft.cloudgovernance.domain.model;

/**
 * How strongly a client wants environment indicators (dev, prod, ...) in resource names.
 */
public enum EnvironmentIndicatorLevel {
    REQUIRED,
    RECOMMENDED,
    OPTIONAL
}
