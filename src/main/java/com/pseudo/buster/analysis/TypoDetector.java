package com.pseudo.buster.analysis;

import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;
import com.pseudo.buster.synonym.SynonymTable;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags identifiers that look like misspelled variable names: unknown to the
 * synonym table, longer than four characters, and written in mixed case.
 * All-lowercase and all-uppercase tokens are never flagged.
 */
public class TypoDetector implements LogicDetector {

    private static final Pattern IDENTIFIER = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]*\\b");
    private static final int MIN_SUSPICIOUS_LENGTH = 5;

    private final SynonymTable synonymTable;

    public TypoDetector(SynonymTable synonymTable) {
        this.synonymTable = Objects.requireNonNull(synonymTable, "synonymTable");
    }

    @Override
    public FindingType getType() {
        return FindingType.TYPO;
    }

    @Override
    public Optional<Finding> detect(String normalizedLine, String originalLine) {
        Set<String> suspects = findSuspectTokens(normalizedLine);
        if (suspects.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Finding.typo(suspects, originalLine));
    }

    /**
     * Suspected misspellings in first-seen order, each reported once.
     */
    public Set<String> findSuspectTokens(String line) {
        Set<String> suspects = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(line);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_SUSPICIOUS_LENGTH && isMixedCase(token) && !synonymTable.isKnown(token)) {
                suspects.add(token);
            }
        }
        return suspects;
    }

    static boolean isMixedCase(String token) {
        boolean upper = false;
        boolean lower = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            upper |= Character.isUpperCase(c);
            lower |= Character.isLowerCase(c);
        }
        return upper && lower;
    }
}
