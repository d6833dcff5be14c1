package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.NamingPattern;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies names into naming patterns and converts between them.
 */
final class NamingPatterns {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}.*");
    private static final Pattern WORD_SEPARATORS = Pattern.compile("[-_.\\s]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private NamingPatterns() {
    }

    /**
     * Checked in order: UUID, snake, kebab, all upper, all lower, Pascal, camel.
     */
    static NamingPattern classify(String name) {
        if (name == null || name.isEmpty()) {
            return NamingPattern.OTHER;
        }
        if (UUID_PATTERN.matcher(name).matches()) {
            return NamingPattern.UUID;
        }
        if (name.contains("_")) {
            return NamingPattern.SNAKE_CASE;
        }
        if (name.contains("-")) {
            return NamingPattern.KEBAB_CASE;
        }
        boolean hasUpper = name.chars().anyMatch(Character::isUpperCase);
        boolean hasLower = name.chars().anyMatch(Character::isLowerCase);
        if (hasUpper && !hasLower) {
            return NamingPattern.UPPERCASE;
        }
        if (!hasUpper) {
            return NamingPattern.LOWERCASE;
        }
        char first = name.charAt(0);
        if (Character.isUpperCase(first)) {
            return NamingPattern.PASCAL_CASE;
        }
        if (Character.isLowerCase(first)) {
            return NamingPattern.CAMEL_CASE;
        }
        return NamingPattern.OTHER;
    }

    /**
     * Best-effort rename into the target pattern.
     */
    static String convert(String name, NamingPattern target) {
        String[] words = Arrays.stream(WORD_SEPARATORS.split(CAMEL_BOUNDARY.matcher(name).replaceAll("-")))
                .filter(w -> !w.isEmpty())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toArray(String[]::new);
        if (words.length == 0) {
            return name;
        }
        return switch (target) {
            case KEBAB_CASE -> String.join("-", words);
            case SNAKE_CASE -> String.join("_", words);
            case LOWERCASE -> String.join("", words);
            case UPPERCASE -> String.join("", words).toUpperCase(Locale.ROOT);
            case CAMEL_CASE -> words[0] + Arrays.stream(words).skip(1)
                    .map(NamingPatterns::capitalize).collect(Collectors.joining());
            case PASCAL_CASE -> Arrays.stream(words)
                    .map(NamingPatterns::capitalize).collect(Collectors.joining());
            default -> name.toLowerCase(Locale.ROOT);
        };
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
