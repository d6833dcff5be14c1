package com.microsoft.cloudgovernance.domain.model;

/**
 * Naming styles recognised by the naming analyzer.
 */
public enum NamingPattern {
    LOWERCASE("Lowercase"),
    UPPERCASE("Uppercase"),
    CAMEL_CASE("CamelCase"),
    PASCAL_CASE("PascalCase"),
    SNAKE_CASE("Snake_case"),
    KEBAB_CASE("Kebab-case"),
    UUID("UUID"),
    OTHER("Other");

    private final String displayName;

    NamingPattern(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lenient lookup accepting either the enum name or the display name.
     */
    public static NamingPattern fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (NamingPattern pattern : values()) {
            if (pattern.name().equalsIgnoreCase(normalized)
                    || pattern.displayName.equalsIgnoreCase(normalized)) {
                return pattern;
            }
        }
        return null;
    }
}
