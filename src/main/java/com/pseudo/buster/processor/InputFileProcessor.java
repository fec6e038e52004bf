package com.pseudo.buster.processor;

import com.pseudo.buster.evaluation.MetricsCollector;
import com.pseudo.buster.model.AnalyzedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads a UTF-8 text file line by line and emits one output line per
 * non-blank input line, in input order.
 */
public class InputFileProcessor {

    private static final Logger logger = LoggerFactory.getLogger(InputFileProcessor.class);

    private final LineProcessor lineProcessor;
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;

    public InputFileProcessor() {
        this(new LineProcessor(), false);
    }

    public InputFileProcessor(LineProcessor lineProcessor, boolean collectMetrics) {
        this.lineProcessor = Objects.requireNonNull(lineProcessor, "lineProcessor");
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
    }

    /**
     * Processes every line of the input file.
     *
     * @param inputFile Path to a UTF-8 text file
     * @param output    Receives each output line as soon as it is computed
     * @return Number of output lines emitted
     * @throws IOException If the file is missing, unreadable, or not valid UTF-8
     */
    public int processFile(Path inputFile, Consumer<String> output) throws IOException {
        Objects.requireNonNull(output, "output");
        if (!Files.exists(inputFile)) {
            throw new NoSuchFileException(inputFile.toString(), null, "Input file does not exist");
        }

        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        int emitted = 0;
        try (BufferedReader reader = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<AnalyzedLine> analyzed = lineProcessor.analyze(line);
                if (collectMetrics) {
                    metricsCollector.recordLine(analyzed.orElse(null));
                }
                if (analyzed.isPresent()) {
                    output.accept(analyzed.get().toOutputLine());
                    emitted++;
                }
            }
        }

        if (collectMetrics) {
            metricsCollector.endAnalysis();
            metricsCollector.printReport();
        }

        logger.debug("Emitted {} lines for {}", emitted, inputFile);
        return emitted;
    }

    /**
     * Get the metrics collector, or null when metrics are disabled.
     */
    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }
}
