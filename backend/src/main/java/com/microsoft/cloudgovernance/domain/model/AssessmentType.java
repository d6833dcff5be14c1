package com.microsoft.cloudgovernance.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of assessment requested. Determines which analyzers run.
 */
public enum AssessmentType {
    NAMING_CONVENTION(EnumSet.of(AnalyzerKind.NAMING)),
    TAGGING(EnumSet.of(AnalyzerKind.TAGGING)),
    GOVERNANCE_FULL(EnumSet.of(AnalyzerKind.NAMING, AnalyzerKind.TAGGING));

    private final Set<AnalyzerKind> analyzers;

    AssessmentType(Set<AnalyzerKind> analyzers) {
        this.analyzers = analyzers;
    }

    /**
     * Analyzers to run, in {@link AnalyzerKind} declaration order.
     */
    public Set<AnalyzerKind> getAnalyzers() {
        return EnumSet.copyOf(analyzers);
    }
}
