package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Scores resource names against naming policy.
 *
 * CHECKS PER RESOURCE:
 * 1. Naming pattern is one of the allowed patterns
 * 2. Environment indicator present (when required)
 * 3. No characters outside [a-zA-Z0-9-_.]
 * 4. At most 63 characters
 * 5. Resource type abbreviation prefix (when expected)
 * 6. Pattern consistent with other resources of the same type
 *
 * SCORING:
 * 50% allowed-pattern compliance
 * + 25% environment indicator compliance (full marks once the threshold is met)
 * + 25% share of resources without character or length violations
 */
@Component
@Slf4j
public class NamingConventionAnalyzer implements PolicyAnalyzer {

    static final int MAX_NAME_LENGTH = 63;
    static final double TYPE_CONSISTENCY_THRESHOLD = 70.0;
    static final double REQUIRED_ENVIRONMENT_THRESHOLD = 90.0;
    static final double RECOMMENDED_ENVIRONMENT_THRESHOLD = 70.0;

    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^a-zA-Z0-9\\-_.]");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final Pattern TRAILING_DIGITS = Pattern.compile("\\d+$");

    private static final List<String> COMMON_ENVIRONMENTS =
            List.of("dev", "test", "staging", "stage", "prod", "production", "qa", "uat");
    private static final List<String> ENVIRONMENT_METHOD_ENVIRONMENTS =
            List.of("dev", "test", "staging", "prod", "production");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.NAMING;
    }

    @Override
    public AnalysisResult analyze(List<ResourceSnapshot> resources, PolicyPreferences preferences) {
        PolicyPreferences policy = preferences != null ? preferences : PolicyPreferences.defaults();
        List<String> environments = environmentIndicators(policy.organizationMethod());
        NamingPattern preferredPattern = policy.orderedNamingPatterns().get(0);

        List<ResourceSnapshot> analyzable = new ArrayList<>();
        List<SkippedResource> skipped = new ArrayList<>();
        for (ResourceSnapshot resource : resources) {
            String problem = malformedReason(resource);
            if (problem != null) {
                skipped.add(new SkippedResource(
                        resource == null ? null : resource.resourceId(),
                        resource == null ? null : resource.name(),
                        problem));
            } else {
                analyzable.add(resource);
            }
        }

        Map<String, NamingPattern> dominantPatternByType = inconsistentTypes(analyzable);

        List<Violation> violations = new ArrayList<>();
        List<ResourceEvaluation> evaluations = new ArrayList<>();
        Map<NamingPattern, Long> distribution = new EnumMap<>(NamingPattern.class);
        int patternCompliant = 0;
        int withEnvironment = 0;
        int standardViolations = 0;

        for (ResourceSnapshot resource : analyzable) {
            List<Violation> found = new ArrayList<>();
            NamingPattern pattern;
            String environment;
            try {
                pattern = NamingPatterns.classify(resource.name());
                environment = detectEnvironment(resource.name(), environments);
                evaluate(resource, pattern, environment, policy, preferredPattern, dominantPatternByType, found);
            } catch (RuntimeException e) {
                log.warn("Skipping resource {} in naming analysis: {}", resource.resourceId(), e.getMessage());
                skipped.add(new SkippedResource(resource.resourceId(), resource.name(),
                        "Naming evaluation failed: " + e.getMessage()));
                continue;
            }

            distribution.merge(pattern, 1L, Long::sum);
            boolean allowed = policy.allowedNamingPatterns().contains(pattern);
            if (allowed) {
                patternCompliant++;
            }
            if (environment != null) {
                withEnvironment++;
            }
            if (found.stream().anyMatch(v -> v.rule() == ViolationRule.INVALID_CHARACTERS
                    || v.rule() == ViolationRule.NAME_TOO_LONG)) {
                standardViolations++;
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("pattern", pattern.getDisplayName());
            if (environment != null) {
                attributes.put("environment", environment);
            }
            violations.addAll(found);
            evaluations.add(new ResourceEvaluation(
                    resource.resourceId(),
                    resource.name(),
                    found.isEmpty(),
                    found.isEmpty() ? HUNDRED : BigDecimal.ZERO,
                    attributes));
        }

        int analyzed = evaluations.size();
        BigDecimal patternCompliance = percentage(patternCompliant, analyzed);
        BigDecimal environmentCoverage = percentage(withEnvironment, analyzed);
        BigDecimal environmentCompliance = environmentCompliance(policy, environmentCoverage);
        BigDecimal standardViolationRate = percentage(standardViolations, analyzed);

        BigDecimal score = analyzed == 0
                ? HUNDRED.setScale(2, RoundingMode.HALF_UP)
                : patternCompliance.multiply(new BigDecimal("0.50"))
                        .add(environmentCompliance.multiply(new BigDecimal("0.25")))
                        .add(HUNDRED.subtract(standardViolationRate).multiply(new BigDecimal("0.25")))
                        .setScale(2, RoundingMode.HALF_UP);

        Map<String, BigDecimal> metrics = new LinkedHashMap<>();
        metrics.put("patternCompliance", patternCompliance);
        metrics.put("environmentIndicatorCoverage", environmentCoverage);
        metrics.put("environmentIndicatorCompliance", environmentCompliance);
        metrics.put("standardViolationRate", standardViolationRate);

        log.debug("Naming analysis: {} resources, {} violations, score {}", analyzed, violations.size(), score);
        return new AnalysisResult(
                AnalyzerKind.NAMING,
                score,
                resources.size(),
                analyzed,
                violations,
                evaluations,
                skipped,
                sortedDistribution(distribution),
                metrics);
    }

    private void evaluate(
            ResourceSnapshot resource,
            NamingPattern pattern,
            String environment,
            PolicyPreferences policy,
            NamingPattern preferredPattern,
            Map<String, NamingPattern> dominantPatternByType,
            List<Violation> found
    ) {
        String name = resource.name();
        boolean allowed = policy.allowedNamingPatterns().contains(pattern);

        if (!allowed) {
            String allowedNames = String.join(", ", policy.orderedNamingPatterns().stream()
                    .map(NamingPattern::getDisplayName).toList());
            found.add(violation(ViolationRule.DISALLOWED_NAMING_PATTERN, resource,
                    "Naming pattern '" + pattern.getDisplayName() + "' is not one of the allowed patterns: " + allowedNames,
                    "Rename to '" + NamingPatterns.convert(name, preferredPattern) + "'",
                    EffortLevel.MEDIUM));
        }

        if (policy.requiresEnvironmentIndicator() && environment == null) {
            found.add(violation(ViolationRule.MISSING_ENVIRONMENT_INDICATOR, resource,
                    "Resource name does not include an environment indicator",
                    "Include the environment in the name, e.g. '" + name + "-prod'",
                    EffortLevel.MEDIUM));
        }

        if (INVALID_CHARACTERS.matcher(name).find()) {
            found.add(violation(ViolationRule.INVALID_CHARACTERS, resource,
                    "Resource name contains invalid characters",
                    "Rename to '" + INVALID_CHARACTERS.matcher(name).replaceAll("") + "'",
                    EffortLevel.MEDIUM));
        }

        if (name.length() > MAX_NAME_LENGTH) {
            found.add(violation(ViolationRule.NAME_TOO_LONG, resource,
                    "Resource name exceeds maximum length of " + MAX_NAME_LENGTH + " characters",
                    "Shorten the name to " + MAX_NAME_LENGTH + " characters or fewer",
                    EffortLevel.MEDIUM));
        }

        if (policy.requiresResourceTypePrefix()) {
            List<String> prefixes = ResourceTypePrefixes.forType(resource.type());
            if (!prefixes.isEmpty() && !ResourceTypePrefixes.hasExpectedPrefix(name, prefixes)) {
                found.add(violation(ViolationRule.MISSING_RESOURCE_TYPE_PREFIX, resource,
                        "Resource name does not start with a type abbreviation (" + String.join(", ", prefixes) + ")",
                        "Rename to '" + prefixes.get(0) + "-" + NamingPatterns.convert(name, preferredPattern) + "'",
                        EffortLevel.LOW));
            }
        }

        NamingPattern dominant = dominantPatternByType.get(resource.normalizedType());
        if (allowed && dominant != null && dominant != pattern) {
            found.add(violation(ViolationRule.INCONSISTENT_PATTERN, resource,
                    "Naming pattern '" + pattern.getDisplayName() + "' differs from the '"
                            + dominant.getDisplayName() + "' pattern used by most resources of this type",
                    "Align names of " + resource.type() + " resources on one pattern",
                    EffortLevel.LOW));
        }
    }

    /**
     * Dominant pattern per type, only for types whose consistency is below the threshold.
     */
    private Map<String, NamingPattern> inconsistentTypes(List<ResourceSnapshot> resources) {
        Map<String, Map<NamingPattern, Long>> byType = new TreeMap<>();
        for (ResourceSnapshot resource : resources) {
            byType.computeIfAbsent(resource.normalizedType(), t -> new EnumMap<>(NamingPattern.class))
                    .merge(NamingPatterns.classify(resource.name()), 1L, Long::sum);
        }

        Map<String, NamingPattern> result = new HashMap<>();
        byType.forEach((type, counts) -> {
            long total = counts.values().stream().mapToLong(Long::longValue).sum();
            if (total < 2) {
                return;
            }
            Map.Entry<NamingPattern, Long> top = counts.entrySet().stream()
                    .max(Comparator.<Map.Entry<NamingPattern, Long>>comparingLong(Map.Entry::getValue)
                            .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                    .orElseThrow();
            double consistency = top.getValue() * 100.0 / total;
            if (consistency < TYPE_CONSISTENCY_THRESHOLD) {
                result.put(type, top.getKey());
            }
        });
        return result;
    }

    private BigDecimal environmentCompliance(PolicyPreferences policy, BigDecimal coverage) {
        if (!policy.requiresEnvironmentIndicator()
                && policy.environmentIndicatorLevel() != EnvironmentIndicatorLevel.RECOMMENDED) {
            return HUNDRED;
        }
        double threshold = policy.environmentIndicatorLevel() == EnvironmentIndicatorLevel.REQUIRED
                ? REQUIRED_ENVIRONMENT_THRESHOLD
                : RECOMMENDED_ENVIRONMENT_THRESHOLD;
        return coverage.doubleValue() >= threshold ? HUNDRED : coverage;
    }

    static String detectEnvironment(String name, List<String> environments) {
        for (String token : TOKEN_SEPARATOR.split(name.toLowerCase(Locale.ROOT))) {
            String stripped = TRAILING_DIGITS.matcher(token).replaceAll("");
            if (environments.contains(stripped)) {
                return stripped;
            }
        }
        return null;
    }

    static List<String> environmentIndicators(String organizationMethod) {
        return "environment".equalsIgnoreCase(organizationMethod)
                ? ENVIRONMENT_METHOD_ENVIRONMENTS
                : COMMON_ENVIRONMENTS;
    }

    private static String malformedReason(ResourceSnapshot resource) {
        if (resource == null) {
            return "Resource is null";
        }
        if (resource.name() == null || resource.name().isBlank()) {
            return "Resource has no name";
        }
        if (resource.type() == null || resource.type().isBlank()) {
            return "Resource has no type";
        }
        return null;
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

    private static Map<String, Long> sortedDistribution(Map<NamingPattern, Long> distribution) {
        Map<String, Long> sorted = new LinkedHashMap<>();
        distribution.entrySet().stream()
                .sorted(Comparator.<Map.Entry<NamingPattern, Long>>comparingLong(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey))
                .forEach(e -> sorted.put(e.getKey().getDisplayName(), e.getValue()));
        return sorted;
    }
}
