package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.AnalyzerKind;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;

import java.util.List;

/**
 * A governance analyzer.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Pure: no I/O, no clock, no shared mutable state
 * 2. Deterministic: same input gives identical output, in input order
 * 3. Never skip because preferences are missing; fall back to the default policy
 * 4. Skip and record a malformed resource instead of failing the whole run
 */
public interface PolicyAnalyzer {

    AnalyzerKind kind();

    AnalysisResult analyze(List<ResourceSnapshot> resources, PolicyPreferences preferences);
}
