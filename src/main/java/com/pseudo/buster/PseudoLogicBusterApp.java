package com.pseudo.buster;

import com.pseudo.buster.processor.InputFileProcessor;
import com.pseudo.buster.processor.LineProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the pseudo-code logic analyzer.
 * Prints one line per non-blank input line: a normalized statement or a FLAG.
 */
public class PseudoLogicBusterApp {

    private static final Logger logger = LoggerFactory.getLogger(PseudoLogicBusterApp.class);

    static final String METRICS_PROPERTY = "buster.metrics";

    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Usage: java -jar pseudo-logic-buster.jar <input_file.txt>");
            System.exit(1);
        }

        String inputPath = args[0];
        logger.info("Starting pseudo-code logic analysis");
        logger.info("Input file: {}", inputPath);

        try {
            Path path = Paths.get(inputPath);
            boolean collectMetrics = Boolean.parseBoolean(System.getProperty(METRICS_PROPERTY, "false"));
            InputFileProcessor processor = new InputFileProcessor(new LineProcessor(), collectMetrics);

            int emitted = processor.processFile(path, System.out::println);

            logger.info("Processing complete, {} lines emitted", emitted);

        } catch (Exception e) {
            logger.error("Error processing input file", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
