package com.microsoft.cloudgovernance.domain.model;

/**
 * Closed set of policy analyzers.
 */
public enum AnalyzerKind {
    NAMING,
    TAGGING
}
