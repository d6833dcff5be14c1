package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.AnalyzerKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Combines analyzer scores into the overall governance score.
 *
 * Weighted mean over the analyzers that actually ran; weights are renormalised
 * so a naming-only assessment scores on naming alone. Analyzers are visited in
 * enum order and the result is rounded HALF_UP to two decimals.
 */
@Component
public class ScoreAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100).setScale(2, RoundingMode.HALF_UP);

    private final Map<AnalyzerKind, BigDecimal> weights = new EnumMap<>(AnalyzerKind.class);

    public ScoreAggregator(
            @Value("${compass.scoring.weights.naming:0.5}") double namingWeight,
            @Value("${compass.scoring.weights.tagging:0.5}") double taggingWeight
    ) {
        if (namingWeight < 0 || taggingWeight < 0) {
            throw new IllegalArgumentException("Analyzer weights must not be negative");
        }
        weights.put(AnalyzerKind.NAMING, BigDecimal.valueOf(namingWeight));
        weights.put(AnalyzerKind.TAGGING, BigDecimal.valueOf(taggingWeight));
    }

    public BigDecimal aggregate(Map<AnalyzerKind, BigDecimal> scores) {
        if (scores.isEmpty()) {
            return HUNDRED;
        }

        BigDecimal weightedSum = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        BigDecimal plainSum = BigDecimal.ZERO;
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            BigDecimal score = scores.get(kind);
            if (score == null) {
                continue;
            }
            BigDecimal weight = weights.getOrDefault(kind, BigDecimal.ZERO);
            weightedSum = weightedSum.add(score.multiply(weight));
            totalWeight = totalWeight.add(weight);
            plainSum = plainSum.add(score);
        }

        if (totalWeight.signum() == 0) {
            return plainSum.divide(BigDecimal.valueOf(scores.size()), 2, RoundingMode.HALF_UP);
        }
        return weightedSum.divide(totalWeight, 2, RoundingMode.HALF_UP);
    }

    public Map<AnalyzerKind, BigDecimal> getWeights() {
        return Map.copyOf(weights);
    }
}
