package com.pseudo.buster.model;

import java.util.Objects;

/**
 * A single diagnostic attached to one input line.
 */
public final class Finding {

    private final FindingType type;
    private final String message;
    private final String originalLine;

    private Finding(FindingType type, String message, String originalLine) {
        this.type = Objects.requireNonNull(type, "type");
        this.message = Objects.requireNonNull(message, "message");
        this.originalLine = Objects.requireNonNull(originalLine, "originalLine");
    }

    public static Finding redundant(String atom, String originalLine) {
        return new Finding(FindingType.REDUNDANT, "Redundant condition '" + atom + "'", originalLine);
    }

    public static Finding contradiction(String originalLine) {
        return new Finding(FindingType.CONTRADICTION, "Contradictory/unreachable logic", originalLine);
    }

    public static Finding typo(Iterable<String> tokens, String originalLine) {
        return new Finding(FindingType.TYPO,
                "Potential typo(s) in variable name(s): " + String.join(", ", tokens), originalLine);
    }

    public static Finding illogical(Iterable<String> descriptions, String originalLine) {
        return new Finding(FindingType.ILLOGICAL,
                "Illogical comparison: " + String.join(", ", descriptions), originalLine);
    }

    public FindingType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public String getOriginalLine() {
        return originalLine;
    }

    /**
     * The output line for this finding, e.g.
     * {@code FLAG: Contradictory/unreachable logic in line: IF ...}.
     */
    public String render() {
        return "FLAG: " + message + " in line: " + originalLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Finding finding = (Finding) o;
        return type == finding.type
                && message.equals(finding.message)
                && originalLine.equals(finding.originalLine);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, originalLine);
    }

    @Override
    public String toString() {
        return render();
    }
}
