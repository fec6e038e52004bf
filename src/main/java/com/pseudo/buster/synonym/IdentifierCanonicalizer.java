package com.pseudo.buster.synonym;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-style canonicalization for identifiers that have no registered alias.
 * Converts camelCase, PascalCase, and space or hyphen separated spellings into
 * a single lowercase, underscore-separated form.
 */
public final class IdentifierCanonicalizer {

    private static final Pattern CASE_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

    private IdentifierCanonicalizer() {
        // Utility class
    }

    /**
     * Rewrites an identifier into lowercase snake_case.
     * {@code accountStatus}, {@code Account-Status} and {@code account status}
     * all become {@code account_status}.
     *
     * @param identifier The identifier in any casing or delimiter style
     * @return The snake_case form, never null
     */
    public static String toSnakeCase(String identifier) {
        if (identifier == null) {
            return "";
        }
        String result = CASE_BOUNDARY.matcher(identifier).replaceAll("$1_$2");
        result = SEPARATORS.matcher(result).replaceAll("_");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Removes surrounding whitespace and any single or double quotes.
     */
    static String unquote(String identifier) {
        return identifier.strip().replace("'", "").replace("\"", "");
    }
}
