package org.namix.naming;

import java.util.Locale;

/**
 * Naming conventions that can be selected through configuration.
 */
public enum NamingConvention {
    NONE,
    SNAKE_CASE,
    LOWER_CASE,
    UPPER_CASE,
    UPPER_SNAKE_CASE,
    CAMEL_CASE;

    public NameRewriter createRewriter(Locale locale) {
        return switch (this) {
            case NONE -> NameRewriter.identity();
            case SNAKE_CASE -> new SnakeCaseNameRewriter(locale);
            case LOWER_CASE -> new LowerCaseNameRewriter(locale);
            case UPPER_CASE -> new UpperCaseNameRewriter(locale);
            case UPPER_SNAKE_CASE -> new UpperSnakeCaseNameRewriter(locale);
            case CAMEL_CASE -> new CamelCaseNameRewriter(locale);
        };
    }

    /**
     * Accepts {@code snake_case}, {@code snake-case} and {@code SNAKE_CASE} style spellings.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static NamingConvention fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("naming convention must not be null/blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown naming convention: " + value, e);
        }
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
