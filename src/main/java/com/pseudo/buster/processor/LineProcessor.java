package com.pseudo.buster.processor;

import com.pseudo.buster.analysis.*;
import com.pseudo.buster.model.AnalyzedLine;
import com.pseudo.buster.model.Finding;
import com.pseudo.buster.normalize.LineNormalizer;
import com.pseudo.buster.synonym.DefaultSynonyms;
import com.pseudo.buster.synonym.SynonymTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes a single line and runs the detectors in priority order.
 * The first detector that reports a finding wins; later detectors are not consulted.
 *
 * Holds no per-line state, so one instance can serve any number of lines.
 */
public class LineProcessor {

    private static final Logger logger = LoggerFactory.getLogger(LineProcessor.class);

    private final LineNormalizer normalizer;
    private final List<LogicDetector> detectors;

    public LineProcessor() {
        this(DefaultSynonyms.createDefaultTable());
    }

    public LineProcessor(SynonymTable synonymTable) {
        this(new LineNormalizer(synonymTable), defaultDetectors(synonymTable));
    }

    public LineProcessor(LineNormalizer normalizer, List<LogicDetector> detectors) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Detectors in reporting priority: redundancy, contradiction, typo, illogical comparison.
     */
    public static List<LogicDetector> defaultDetectors(SynonymTable synonymTable) {
        return List.of(
                new RedundancyDetector(),
                new ContradictionDetector(),
                new TypoDetector(synonymTable),
                new IllogicalComparisonDetector()
        );
    }

    public List<LogicDetector> getDetectors() {
        return detectors;
    }

    /**
     * Analyzes one line.
     *
     * @param rawLine The line as read, without its line terminator
     * @return The analysis, or empty for a blank line
     */
    public Optional<AnalyzedLine> analyze(String rawLine) {
        Objects.requireNonNull(rawLine, "rawLine");
        String original = rawLine.strip();
        if (original.isEmpty()) {
            return Optional.empty();
        }

        String normalized = normalizer.normalize(original);

        for (LogicDetector detector : detectors) {
            Optional<Finding> finding = detector.detect(normalized, original);
            if (finding.isPresent()) {
                logger.debug("{} finding for line: {}", detector.getType(), original);
                return Optional.of(new AnalyzedLine(original, normalized, finding.get()));
            }
        }
        return Optional.of(new AnalyzedLine(original, normalized, null));
    }

    /**
     * The single output line for an input line, or empty for a blank line.
     */
    public Optional<String> process(String rawLine) {
        return analyze(rawLine).map(AnalyzedLine::toOutputLine);
    }
}
