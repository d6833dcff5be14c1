package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.AnalyzerKind;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one analyzer over the whole inventory.
 *
 * @param score 0-100, two decimals
 * @param frequencies pattern distribution or tag usage, most frequent first
 * @param metrics named percentages such as tag coverage
 */
public record AnalysisResult(
        AnalyzerKind kind,
        BigDecimal score,
        int totalResources,
        int analyzedResources,
        List<Violation> violations,
        List<ResourceEvaluation> evaluations,
        List<SkippedResource> skipped,
        Map<String, Long> frequencies,
        Map<String, BigDecimal> metrics
) {
    public AnalysisResult {
        violations = List.copyOf(violations);
        evaluations = List.copyOf(evaluations);
        skipped = List.copyOf(skipped);
        frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }
}
