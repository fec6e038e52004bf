package com.pseudo.buster.analysis;

import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;

import java.util.Optional;

/**
 * A heuristic check over a normalized line. Detectors are independent of
 * each other; the line processor decides which result is reported.
 */
public interface LogicDetector {

    FindingType getType();

    /**
     * @param normalizedLine The line after keyword, variable and literal normalization
     * @param originalLine   The trimmed input line, echoed in the finding
     * @return A finding, or empty if no known pattern matched
     */
    Optional<Finding> detect(String normalizedLine, String originalLine);
}
