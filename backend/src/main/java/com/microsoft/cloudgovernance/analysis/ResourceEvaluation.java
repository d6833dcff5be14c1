package com.microsoft.cloudgovernance.analysis;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-resource outcome of an analyzer.
 *
 * @param score analyzer-specific 0-100 value, e.g. required tag coverage
 * @param attributes analyzer-specific details such as the detected naming pattern
 */
public record ResourceEvaluation(
        String resourceId,
        String resourceName,
        boolean compliant,
        BigDecimal score,
        Map<String, String> attributes
) {
    public ResourceEvaluation {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
