package com.pseudo.buster.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites natural-language logic phrasing into the canonical symbol set
 * {@code IF, AND, OR, NOT, ==, >, <, TRUE, FALSE}.
 *
 * Rules are applied in priority order. {@code IS NOT} runs before every other
 * rule so that the bare {@code IS} rule cannot split it into {@code == NOT}.
 */
public class KeywordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(KeywordNormalizer.class);

    private final List<RewriteRule> rules;

    public KeywordNormalizer() {
        this(defaultRules());
    }

    public KeywordNormalizer(List<RewriteRule> rules) {
        this.rules = new ArrayList<>(rules);
        // List.sort is stable, equal priorities keep their declared order
        this.rules.sort(Comparator.comparingInt(RewriteRule::getPriority));
    }

    /**
     * The built-in keyword rules, in application order.
     */
    public static List<RewriteRule> defaultRules() {
        return List.of(
                rule("is-not", 0, "NOT", "IS NOT"),
                rule("if", 10, "IF", "IF", "WHENEVER", "PROVIDED THAT", "ONLY WHEN"),
                rule("and", 20, "AND", "AND", "ALSO", "IN ADDITION TO"),
                rule("or", 30, "OR", "OR", "EITHER", "UNLESS"),
                rule("not", 40, "NOT", "NOT", "DIFFERENT FROM"),
                rule("equals", 50, "==", "IS EQUAL TO", "EQUAL TO", "EQUALS", "IS SAME AS", "MATCHES"),
                rule("greater-than", 60, ">", "IS GREATER THAN", "IS ABOVE", "GREATER THAN", "ABOVE"),
                rule("less-than", 70, "<", "IS LESS THAN", "IS BELOW", "LESS THAN", "BELOW"),
                rule("true", 80, "TRUE", "TRUE", "YES", "ACTIVE"),
                rule("false", 90, "FALSE", "FALSE", "NO", "INACTIVE"),
                // Must stay last: every IS-prefixed phrase above has been consumed
                rule("is", 100, "==", "IS")
        );
    }

    private static RewriteRule rule(String name, int priority, String replacement, String... phrases) {
        return RewriteRule.builder()
                .name(name)
                .phrases(phrases)
                .replacement(replacement)
                .priority(priority)
                .build();
    }

    public List<RewriteRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Rewrites keyword synonyms in a line.
     *
     * @param line The raw line text
     * @return The line with canonical keywords
     */
    public String normalize(String line) {
        Objects.requireNonNull(line, "line");
        String result = line;
        for (RewriteRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                logger.debug("Keyword rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result;
    }
}
