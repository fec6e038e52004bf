package com.pseudo.buster.evaluation;

import com.pseudo.buster.model.AnalyzedLine;
import com.pseudo.buster.model.FindingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects run statistics: how many lines were read, skipped, left clean or
 * flagged, and how long the run took.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;

    // Line metrics
    private int totalLines = 0;
    private int blankLines = 0;
    private int cleanLines = 0;

    private final Map<FindingType, Integer> findingCounts = new EnumMap<>(FindingType.class);

    /**
     * Start timing the analysis.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the analysis.
     */
    public void endAnalysis() {
        if (startTime == null) {
            throw new IllegalStateException("endAnalysis called before startAnalysis");
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    /**
     * Record one input line.
     *
     * @param line The analysis result, or null for a blank line
     */
    public void recordLine(AnalyzedLine line) {
        totalLines++;
        if (line == null) {
            blankLines++;
            return;
        }
        if (line.isClean()) {
            cleanLines++;
        } else {
            line.getFinding().ifPresent(finding -> findingCounts.merge(finding.getType(), 1, Integer::sum));
        }
    }

    /**
     * Generate a metrics report snapshot.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.totalLines = totalLines;
        report.blankLines = blankLines;
        report.analyzedLines = totalLines - blankLines;
        report.cleanLines = cleanLines;

        report.findingCounts = new EnumMap<>(FindingType.class);
        for (FindingType type : FindingType.values()) {
            report.findingCounts.put(type, findingCounts.getOrDefault(type, 0));
        }
        report.flaggedLines = report.findingCounts.values().stream().mapToInt(Integer::intValue).sum();
        report.flaggedPercentage = calculatePercentage(report.flaggedLines, report.analyzedLines);

        return report;
    }

    /**
     * Log a human-readable report. Standard output is left untouched.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        logger.info("=".repeat(60));
        logger.info("PSEUDO-CODE LOGIC ANALYSIS - RUN SUMMARY");
        logger.info("=".repeat(60));
        logger.info("  Total Analysis Time: {} ms", report.totalAnalysisTimeMs);
        logger.info("  Lines Read:          {}", report.totalLines);
        logger.info("  Blank Lines Skipped: {}", report.blankLines);
        logger.info("  Clean Lines:         {}", report.cleanLines);
        logger.info(String.format("  Flagged Lines:       %d (%.1f%%)", report.flaggedLines, report.flaggedPercentage));
        report.findingCounts.forEach((type, count) ->
                logger.info(String.format("    %-15s: %,6d", type, count)));
        logger.info("=".repeat(60));
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        public long totalAnalysisTimeMs;

        public int totalLines;
        public int blankLines;
        public int analyzedLines;
        public int cleanLines;
        public int flaggedLines;
        public double flaggedPercentage;

        // Every finding type is present, zero when unseen
        public Map<FindingType, Integer> findingCounts;
    }
}
