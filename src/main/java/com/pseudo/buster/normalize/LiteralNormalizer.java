package com.pseudo.buster.normalize;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts exactly one space on each side of {@code ==} in boolean literal
 * comparisons and upper-cases the literal. Cosmetic only.
 */
public class LiteralNormalizer {

    private static final Pattern BOOLEAN_COMPARISON =
            Pattern.compile("(\\S?)\\s*==\\s*(TRUE|FALSE)\\b", Pattern.CASE_INSENSITIVE);

    public String normalize(String line) {
        Objects.requireNonNull(line, "line");
        Matcher matcher = BOOLEAN_COMPARISON.matcher(line);
        StringBuilder result = new StringBuilder(line.length());
        while (matcher.find()) {
            String left = matcher.group(1);
            String literal = matcher.group(2).toUpperCase(Locale.ROOT);
            String replacement = left.isEmpty() ? "== " + literal : left + " == " + literal;
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
