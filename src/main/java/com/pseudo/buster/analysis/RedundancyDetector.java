package com.pseudo.buster.analysis;

import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Flags a condition that appears more than once in the same line.
 *
 * The line is split flat on {@code AND}/{@code OR}; parentheses are not
 * respected, so nested groups can produce false positives and negatives.
 */
public class RedundancyDetector implements LogicDetector {

    private static final Pattern CONNECTIVES = Pattern.compile("\\bAND\\b|\\bOR\\b");
    private static final Pattern ACTION_CLAUSE = Pattern.compile("\\b(?:THEN|DO|ELSE)\\b.*");
    private static final Pattern LEADING_IF = Pattern.compile("^IF\\b\\s*");

    @Override
    public FindingType getType() {
        return FindingType.REDUNDANT;
    }

    @Override
    public Optional<Finding> detect(String normalizedLine, String originalLine) {
        List<String> repeats = findRepeatedConditions(normalizedLine);
        if (repeats.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Finding.redundant(repeats.get(0), originalLine));
    }

    /**
     * Every atom that repeats an earlier atom, scanning left to right.
     */
    public List<String> findRepeatedConditions(String line) {
        Set<String> seen = new HashSet<>();
        List<String> repeats = new ArrayList<>();
        for (String atom : CONNECTIVES.split(line)) {
            String condition = clean(atom);
            if (condition.isEmpty()) {
                continue;
            }
            if (!seen.add(condition)) {
                repeats.add(condition);
            }
        }
        return repeats;
    }

    static String clean(String atom) {
        String condition = ACTION_CLAUSE.matcher(atom.strip()).replaceFirst("");
        condition = LEADING_IF.matcher(condition.strip()).replaceFirst("");
        return condition.strip();
    }
}
