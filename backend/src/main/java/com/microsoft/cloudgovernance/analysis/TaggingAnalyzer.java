package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Scores resource tags against the required tag set.
 *
 * CHECKS PER RESOURCE:
 * 1. Resource has at least one tag
 * 2. Required tags present (keys match case-insensitively)
 * 3. No empty tag values
 * 4. Tag key casing matches the casing used by most resources
 *
 * Under the default policy, required tags are only enforced on resource types
 * that carry cost (VMs, storage, SQL, web apps, key vaults, virtual networks).
 * A client policy enforces them everywhere.
 *
 * SCORING:
 * 30% tagged-resource coverage
 * + 40% mean required-tag coverage
 * + 30% (100 - severity penalty), penalty = 10 per High, 5 per Medium, 2 per Low,
 *   x1.5 when tag compliance is enforced, capped at 100
 */
@Component
@Slf4j
public class TaggingAnalyzer implements PolicyAnalyzer {

    static final Set<String> TAG_CRITICAL_TYPES = Set.of(
            "microsoft.compute/virtualmachines",
            "microsoft.storage/storageaccounts",
            "microsoft.sql/servers",
            "microsoft.web/sites",
            "microsoft.keyvault/vaults",
            "microsoft.network/virtualnetworks"
    );

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Map<Severity, Integer> PENALTY_POINTS = Map.of(
            Severity.CRITICAL, 15,
            Severity.HIGH, 10,
            Severity.MEDIUM, 5,
            Severity.LOW, 2
    );

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.TAGGING;
    }

    @Override
    public AnalysisResult analyze(List<ResourceSnapshot> resources, PolicyPreferences preferences) {
        PolicyPreferences policy = preferences != null ? preferences : PolicyPreferences.defaults();
        List<String> requiredTags = policy.requiredTags();

        List<ResourceSnapshot> analyzable = new ArrayList<>();
        List<SkippedResource> skipped = new ArrayList<>();
        for (ResourceSnapshot resource : resources) {
            if (resource == null || resource.resourceId() == null || resource.resourceId().isBlank()) {
                skipped.add(new SkippedResource(
                        resource == null ? null : resource.resourceId(),
                        resource == null ? null : resource.name(),
                        "Resource has no identifier"));
            } else {
                analyzable.add(resource);
            }
        }

        Map<String, String> canonicalKeys = canonicalTagKeys(analyzable);

        List<Violation> violations = new ArrayList<>();
        List<ResourceEvaluation> evaluations = new ArrayList<>();
        Map<String, Long> usage = new HashMap<>();
        int tagged = 0;
        BigDecimal requiredCoverageSum = BigDecimal.ZERO;

        for (ResourceSnapshot resource : analyzable) {
            List<Violation> found = new ArrayList<>();
            List<String> missing;
            try {
                missing = missingTags(resource, requiredTags);
                evaluate(resource, policy, missing, canonicalKeys, found);
            } catch (RuntimeException e) {
                log.warn("Skipping resource {} in tagging analysis: {}", resource.resourceId(), e.getMessage());
                skipped.add(new SkippedResource(resource.resourceId(), resource.name(),
                        "Tag evaluation failed: " + e.getMessage()));
                continue;
            }

            if (resource.hasTags()) {
                tagged++;
                resource.tags().keySet().forEach(key ->
                        usage.merge(canonicalKeys.getOrDefault(key.toLowerCase(Locale.ROOT), key), 1L, Long::sum));
            }

            BigDecimal coverage = percentage(requiredTags.size() - missing.size(), requiredTags.size());
            requiredCoverageSum = requiredCoverageSum.add(coverage);

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("tagCount", String.valueOf(resource.tags().size()));
            if (!missing.isEmpty()) {
                attributes.put("missingTags", String.join(",", missing));
            }
            violations.addAll(found);
            evaluations.add(new ResourceEvaluation(resource.resourceId(), resource.name(), found.isEmpty(),
                    coverage, attributes));
        }

        int analyzed = evaluations.size();
        BigDecimal tagCoverage = percentage(tagged, analyzed);
        BigDecimal requiredTagCoverage = analyzed == 0
                ? HUNDRED.setScale(2, RoundingMode.HALF_UP)
                : requiredCoverageSum.divide(BigDecimal.valueOf(analyzed), 2, RoundingMode.HALF_UP);
        BigDecimal penalty = penalty(violations, policy.enforceTagCompliance());

        BigDecimal score = analyzed == 0
                ? HUNDRED.setScale(2, RoundingMode.HALF_UP)
                : tagCoverage.multiply(new BigDecimal("0.30"))
                        .add(requiredTagCoverage.multiply(new BigDecimal("0.40")))
                        .add(HUNDRED.subtract(penalty).multiply(new BigDecimal("0.30")))
                        .setScale(2, RoundingMode.HALF_UP);

        Map<String, BigDecimal> metrics = new LinkedHashMap<>();
        metrics.put("tagCoverage", tagCoverage);
        metrics.put("requiredTagCoverage", requiredTagCoverage);
        metrics.put("violationPenalty", penalty);

        log.debug("Tagging analysis: {} resources, coverage {}%, required coverage {}%, score {}",
                analyzed, tagCoverage, requiredTagCoverage, score);
        return new AnalysisResult(
                AnalyzerKind.TAGGING,
                score,
                resources.size(),
                analyzed,
                violations,
                evaluations,
                skipped,
                sortedUsage(usage),
                metrics);
    }

    private void evaluate(
            ResourceSnapshot resource,
            PolicyPreferences policy,
            List<String> missing,
            Map<String, String> canonicalKeys,
            List<Violation> found
    ) {
        if (!resource.hasTags()) {
            found.add(violation(ViolationRule.NO_TAGS, resource,
                    "Resource has no tags",
                    "Add tags: " + String.join(", ", policy.requiredTags()),
                    effortFor(policy.requiredTags().size())));
            return;
        }

        boolean enforceRequired = policy.clientSpecific()
                || TAG_CRITICAL_TYPES.contains(resource.normalizedType());
        if (enforceRequired && !missing.isEmpty()) {
            found.add(violation(ViolationRule.MISSING_REQUIRED_TAGS, resource,
                    "Missing required tags: " + String.join(", ", missing),
                    "Add missing tags: " + String.join(", ", missing),
                    effortFor(missing.size())));
        }

        List<String> emptyKeys = resource.tags().entrySet().stream()
                .filter(e -> e.getValue() == null || e.getValue().isBlank())
                .map(Map.Entry::getKey)
                .toList();
        if (!emptyKeys.isEmpty()) {
            found.add(violation(ViolationRule.EMPTY_TAG_VALUES, resource,
                    "Tags with empty values: " + String.join(", ", emptyKeys),
                    "Provide values for: " + String.join(", ", emptyKeys),
                    EffortLevel.LOW));
        }

        List<String> offCase = new ArrayList<>();
        for (String key : resource.tags().keySet()) {
            String canonical = canonicalKeys.get(key.toLowerCase(Locale.ROOT));
            if (canonical != null && !canonical.equals(key)) {
                offCase.add("'" + key + "' (expected '" + canonical + "')");
            }
        }
        if (!offCase.isEmpty()) {
            found.add(violation(ViolationRule.INCONSISTENT_TAG_NAMING, resource,
                    "Tag keys use inconsistent casing: " + String.join(", ", offCase),
                    "Rename tag keys to the casing used across the estate",
                    EffortLevel.LOW));
        }
    }

    /**
     * Required tags absent from the resource, in required-tag order. Keys match case-insensitively.
     */
    static List<String> missingTags(ResourceSnapshot resource, List<String> requiredTags) {
        Set<String> present = new HashSet<>();
        resource.tags().keySet().forEach(k -> present.add(k.toLowerCase(Locale.ROOT)));
        return requiredTags.stream()
                .filter(tag -> !present.contains(tag.toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * Most common spelling of each tag key, keyed by its lower-case form.
     * Ties go to the lexicographically smallest spelling.
     */
    private static Map<String, String> canonicalTagKeys(List<ResourceSnapshot> resources) {
        Map<String, Map<String, Long>> spellings = new HashMap<>();
        for (ResourceSnapshot resource : resources) {
            for (String key : resource.tags().keySet()) {
                spellings.computeIfAbsent(key.toLowerCase(Locale.ROOT), k -> new TreeMap<>())
                        .merge(key, 1L, Long::sum);
            }
        }
        Map<String, String> canonical = new HashMap<>();
        spellings.forEach((lower, counts) -> {
            String best = null;
            long bestCount = -1;
            for (var entry : counts.entrySet()) {
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            canonical.put(lower, best);
        });
        return canonical;
    }

    private static BigDecimal penalty(List<Violation> violations, boolean enforced) {
        int points = violations.stream()
                .mapToInt(v -> PENALTY_POINTS.getOrDefault(v.severity(), 0))
                .sum();
        BigDecimal penalty = BigDecimal.valueOf(points);
        if (enforced) {
            penalty = penalty.multiply(new BigDecimal("1.5"));
        }
        return penalty.min(HUNDRED).setScale(2, RoundingMode.HALF_UP);
    }

    private static EffortLevel effortFor(int missingCount) {
        return missingCount > 3 ? EffortLevel.HIGH : EffortLevel.MEDIUM;
    }

    private static Violation violation(ViolationRule rule, ResourceSnapshot resource, String issue,
                                       String recommendation, EffortLevel effort) {
        return new Violation(rule, resource.resourceId(), resource.name(), resource.type(),
                issue, recommendation, effort);
    }

    private static BigDecimal percentage(int part, int total) {
        if (total == 0) {
            return HUNDRED.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(part).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    private static Map<String, Long> sortedUsage(Map<String, Long> usage) {
        Map<String, Long> sorted = new LinkedHashMap<>();
        usage.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }
}
