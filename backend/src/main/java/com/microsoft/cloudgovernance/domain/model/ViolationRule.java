package com.microsoft.cloudgovernance.domain.model;

/**
 * Every rule an analyzer can report.
 *
 * SEVERITY POLICY:
 * Severity is fixed per rule so that the same violation is always
 * reported at the same level, regardless of which analyzer path found it.
 */
public enum ViolationRule {
    // Naming
    INVALID_CHARACTERS(FindingCategory.NAMING, Severity.HIGH),
    NAME_TOO_LONG(FindingCategory.NAMING, Severity.MEDIUM),
    MISSING_RESOURCE_TYPE_PREFIX(FindingCategory.NAMING, Severity.MEDIUM),
    DISALLOWED_NAMING_PATTERN(FindingCategory.NAMING, Severity.HIGH),
    MISSING_ENVIRONMENT_INDICATOR(FindingCategory.NAMING, Severity.CRITICAL),
    INCONSISTENT_PATTERN(FindingCategory.NAMING, Severity.LOW),

    // Tagging
    NO_TAGS(FindingCategory.TAGGING, Severity.HIGH),
    MISSING_REQUIRED_TAGS(FindingCategory.TAGGING, Severity.MEDIUM),
    EMPTY_TAG_VALUES(FindingCategory.TAGGING, Severity.MEDIUM),
    INCONSISTENT_TAG_NAMING(FindingCategory.TAGGING, Severity.LOW),

    // Input problems
    MALFORMED_RESOURCE(FindingCategory.DATA_QUALITY, Severity.LOW);

    private final FindingCategory category;
    private final Severity severity;

    ViolationRule(FindingCategory category, Severity severity) {
        this.category = category;
        this.severity = severity;
    }

    public FindingCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }
}
