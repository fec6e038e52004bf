package com.pseudo.buster.analysis;

import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags comparisons whose right-hand value is quoted the wrong way for its shape:
 * a quoted all-digit value, or an unquoted value that is not all digits.
 * Reasons from surface syntax only; no types are inferred.
 */
public class IllogicalComparisonDetector implements LogicDetector {

    // group 2: quote, group 3: quoted content, group 4: bare value
    private static final Pattern COMPARISON = Pattern.compile(
            "(\\w+)\\s*(?:==|!=|>|<)\\s*(?:(['\"])([\\w\\s]+)\\2|(\\w+))");

    @Override
    public FindingType getType() {
        return FindingType.ILLOGICAL;
    }

    @Override
    public Optional<Finding> detect(String normalizedLine, String originalLine) {
        List<String> problems = describeProblems(normalizedLine);
        if (problems.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Finding.illogical(problems, originalLine));
    }

    public List<String> describeProblems(String line) {
        List<String> problems = new ArrayList<>();
        Matcher matcher = COMPARISON.matcher(line);
        while (matcher.find()) {
            if (matcher.group(2) != null) {
                String quoted = matcher.group(3);
                if (isDigits(quoted.strip())) {
                    problems.add("Comparing string literal \"" + quoted + "\" as number");
                }
            } else {
                String bare = matcher.group(4);
                if (!isDigits(bare)) {
                    problems.add("Comparing unquoted value " + bare + " as string");
                }
            }
        }
        return problems;
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
