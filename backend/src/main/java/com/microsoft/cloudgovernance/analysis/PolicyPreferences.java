package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.EnvironmentIndicatorLevel;
import com.microsoft.cloudgovernance.domain.model.NamingPattern;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable policy the analyzers evaluate against.
 *
 * Built either from a client's stored preferences or from the defaults below.
 *
 * DEFAULT POLICY:
 * - Allowed naming patterns: Kebab-case, Lowercase
 * - Environment indicator: optional
 * - Resource type prefix: expected
 * - Required tags: Environment, Owner, Project, CostCenter, Department
 */
public record PolicyPreferences(
        Set<NamingPattern> allowedNamingPatterns,
        List<String> requiredNamingElements,
        EnvironmentIndicatorLevel environmentIndicatorLevel,
        String organizationMethod,
        List<String> requiredTags,
        boolean enforceTagCompliance,
        boolean clientSpecific
) {
    public static final Set<NamingPattern> DEFAULT_NAMING_PATTERNS =
            EnumSet.of(NamingPattern.KEBAB_CASE, NamingPattern.LOWERCASE);

    public static final List<String> DEFAULT_REQUIRED_TAGS =
            List.of("Environment", "Owner", "Project", "CostCenter", "Department");

    private static final PolicyPreferences DEFAULTS = new PolicyPreferences(
            DEFAULT_NAMING_PATTERNS,
            List.of(),
            EnvironmentIndicatorLevel.OPTIONAL,
            null,
            DEFAULT_REQUIRED_TAGS,
            false,
            false
    );

    public PolicyPreferences {
        allowedNamingPatterns = allowedNamingPatterns == null || allowedNamingPatterns.isEmpty()
                ? DEFAULT_NAMING_PATTERNS
                : Set.copyOf(EnumSet.copyOf(allowedNamingPatterns));
        requiredNamingElements = requiredNamingElements == null ? List.of() : List.copyOf(requiredNamingElements);
        environmentIndicatorLevel = environmentIndicatorLevel == null
                ? EnvironmentIndicatorLevel.OPTIONAL : environmentIndicatorLevel;
        requiredTags = requiredTags == null || requiredTags.isEmpty()
                ? DEFAULT_REQUIRED_TAGS : List.copyOf(requiredTags);
    }

    public static PolicyPreferences defaults() {
        return DEFAULTS;
    }

    /**
     * Allowed patterns in declaration order, so the preferred one is stable.
     */
    public List<NamingPattern> orderedNamingPatterns() {
        return EnumSet.copyOf(allowedNamingPatterns).stream()
                .sorted((a, b) -> Integer.compare(preferenceRank(a), preferenceRank(b)))
                .toList();
    }

    public boolean requiresEnvironmentIndicator() {
        return environmentIndicatorLevel == EnvironmentIndicatorLevel.REQUIRED
                || mentionsElement("environment");
    }

    /**
     * Type prefixes are expected under the default policy or when a client asks for them.
     */
    public boolean requiresResourceTypePrefix() {
        return !clientSpecific || mentionsElement("resource type");
    }

    private boolean mentionsElement(String element) {
        return requiredNamingElements.stream()
                .anyMatch(e -> e.toLowerCase(Locale.ROOT).contains(element));
    }

    private static int preferenceRank(NamingPattern pattern) {
        // Kebab is the Azure recommended style, so it wins when several are allowed
        return pattern == NamingPattern.KEBAB_CASE ? -1 : pattern.ordinal();
    }
}
