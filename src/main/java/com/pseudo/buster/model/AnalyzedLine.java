package com.pseudo.buster.model;

import java.util.Optional;

/**
 * Result of processing one input line: the trimmed original text, its
 * normalized rendering, and at most one finding.
 */
public class AnalyzedLine {

    private final String original;
    private final String normalized;
    private final Finding finding;

    public AnalyzedLine(String original, String normalized, Finding finding) {
        this.original = original;
        this.normalized = normalized;
        this.finding = finding;
    }

    public String getOriginal() {
        return original;
    }

    public String getNormalized() {
        return normalized;
    }

    public Optional<Finding> getFinding() {
        return Optional.ofNullable(finding);
    }

    public boolean isClean() {
        return finding == null;
    }

    /**
     * The single output line: the rendered finding, or the normalized text when clean.
     */
    public String toOutputLine() {
        return finding != null ? finding.render() : normalized;
    }
}
