package com.enterprise.cte.validation;

import java.util.regex.Pattern;

/**
 * Guard for CTE names. A name ends up verbatim in {@code name AS (...)} and
 * {@code SELECT * FROM name}, so it must be a plain unquoted SQL identifier.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {}

    // Letters/underscore start, then alphanumeric/underscore/dollar
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[a-zA-Z_][a-zA-Z0-9_$]*");

    /** Validates a CTE name; case is preserved and significant. */
    public static void validateCteName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("CTE name cannot be null or empty");
        }
        if (!IDENTIFIER_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Invalid CTE name: " + name
                            + ". Must start with a letter or underscore and contain only"
                            + " letters, digits, underscores or dollar signs.");
        }
    }
}
