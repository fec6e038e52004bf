package com.pseudo.buster.analysis;

import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags an {@code ELSE IF} branch whose guard repeats the guard of the
 * {@code IF} it follows, making the branch unreachable. Matching is textual:
 * {@code x > 5 ... ELSE IF x < 5} or differently written equal values are not caught.
 */
public class ContradictionDetector implements LogicDetector {

    private static final Pattern REPEATED_GUARD =
            Pattern.compile("IF (.+?) == (.+?) (?:THEN|DO).+ELSE IF \\1 == \\2(?!\\w)");

    @Override
    public FindingType getType() {
        return FindingType.CONTRADICTION;
    }

    @Override
    public Optional<Finding> detect(String normalizedLine, String originalLine) {
        if (REPEATED_GUARD.matcher(normalizedLine).find()) {
            return Optional.of(Finding.contradiction(originalLine));
        }
        return Optional.empty();
    }
}
