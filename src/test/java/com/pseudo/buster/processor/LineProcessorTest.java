package com.pseudo.buster.processor;

import com.pseudo.buster.analysis.LogicDetector;
import com.pseudo.buster.model.AnalyzedLine;
import com.pseudo.buster.model.Finding;
import com.pseudo.buster.model.FindingType;
import com.pseudo.buster.normalize.LineNormalizer;
import com.pseudo.buster.synonym.DefaultSynonyms;
import com.pseudo.buster.synonym.SynonymTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LineProcessorTest {

    private LineProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new LineProcessor();
    }

    @Nested
    @DisplayName("Reference examples")
    class Examples {

        @Test
        @DisplayName("Repeated condition after IS rewrite is redundant")
        void testRedundantExample() {
            String line = "IF user_type IS \"admin\" AND user_type IS \"admin\" THEN grant_access";
            assertEquals(Optional.of("FLAG: Redundant condition 'user_type == \"admin\"' in line: " + line),
                    processor.process(line));
        }

        @Test
        @DisplayName("Clean line is emitted normalized")
        void testCleanExample() {
            assertEquals(Optional.of("IF user_id > 100 THEN allow"), processor.process("IF ID_of_user > 100 THEN allow"));
        }

        @Test
        @DisplayName("Quoted number is an illogical comparison")
        void testIllogicalExample() {
            String line = "IF purchase_amount == \"50\" THEN flag_review";
            assertEquals(Optional.of("FLAG: Illogical comparison: Comparing string literal \"50\" as number in line: " + line),
                    processor.process(line));
        }

        @Test
        @DisplayName("All-lowercase misspelling is not a typo, but is an unquoted comparison")
        void testLowercaseTypoGap() {
            AnalyzedLine result = processor.analyze("IF accountStatus == activ THEN proceed").orElseThrow();

            assertEquals("IF account_status == activ THEN proceed", result.getNormalized());
            assertEquals(FindingType.ILLOGICAL, result.getFinding().orElseThrow().getType());
            assertEquals("FLAG: Illogical comparison: Comparing unquoted value activ as string in line: "
                    + "IF accountStatus == activ THEN proceed", result.toOutputLine());
        }
    }

    @ParameterizedTest
    @DisplayName("Blank lines produce no output")
    @ValueSource(strings = {"", "   ", "\t \t"})
    void testBlankLines(String line) {
        assertTrue(processor.process(line).isEmpty());
    }

    @Test
    @DisplayName("Original line is echoed trimmed")
    void testTrimmedOriginal() {
        AnalyzedLine result = processor.analyze("   IF a == \"1\"   ").orElseThrow();
        assertEquals("IF a == \"1\"", result.getOriginal());
        assertTrue(result.toOutputLine().endsWith("in line: IF a == \"1\""));
    }

    @Nested
    @DisplayName("Priority")
    class Priority {

        @Test
        @DisplayName("Redundancy wins over typo")
        void testRedundancyOverTypo() {
            Finding finding = processor.analyze("IF a == 1 AND a == 1 THEN grantAcess").orElseThrow()
                    .getFinding().orElseThrow();
            assertEquals(FindingType.REDUNDANT, finding.getType());
        }

        @Test
        @DisplayName("Contradiction wins over typo and illogical comparison")
        void testContradictionOverTypo() {
            Finding finding = processor.analyze("IF a == b THEN grantAcess ELSE IF a == b THEN denyAcess")
                    .orElseThrow().getFinding().orElseThrow();
            assertEquals(FindingType.CONTRADICTION, finding.getType());
        }

        @Test
        @DisplayName("Typo wins over illogical comparison")
        void testTypoOverIllogical() {
            Finding finding = processor.analyze("IF a == b THEN grantAcess").orElseThrow()
                    .getFinding().orElseThrow();
            assertEquals(FindingType.TYPO, finding.getType());
            assertEquals("Potential typo(s) in variable name(s): grantAcess", finding.getMessage());
        }

        @Test
        @DisplayName("Later detectors are not consulted once one reports")
        void testShortCircuit() {
            List<FindingType> consulted = new ArrayList<>();
            SynonymTable table = DefaultSynonyms.createDefaultTable();
            LineProcessor recording = new LineProcessor(new LineNormalizer(table), List.of(
                    recordingDetector(FindingType.REDUNDANT, consulted, false),
                    recordingDetector(FindingType.CONTRADICTION, consulted, true),
                    recordingDetector(FindingType.TYPO, consulted, true)
            ));

            Finding finding = recording.analyze("IF x == 1").orElseThrow().getFinding().orElseThrow();

            assertEquals(FindingType.CONTRADICTION, finding.getType());
            assertEquals(List.of(FindingType.REDUNDANT, FindingType.CONTRADICTION), consulted);
        }
    }

    @Test
    @DisplayName("Default detectors are ordered redundancy, contradiction, typo, illogical")
    void testDefaultDetectorOrder() {
        List<FindingType> order = processor.getDetectors().stream().map(LogicDetector::getType).toList();
        assertEquals(List.of(FindingType.REDUNDANT, FindingType.CONTRADICTION, FindingType.TYPO, FindingType.ILLOGICAL),
                order);
    }

    static Stream<Arguments> aliases() {
        List<Arguments> arguments = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : DefaultSynonyms.createDefaultTable().getEntries().entrySet()) {
            for (String alias : entry.getValue()) {
                arguments.add(Arguments.of(entry.getKey(), alias));
            }
        }
        return arguments.stream();
    }

    @ParameterizedTest(name = "{1} -> {0}")
    @DisplayName("Every alias behaves like its canonical name")
    @MethodSource("aliases")
    void testAliasEquivalence(String canonical, String alias) {
        String template = "IF %s > 5 THEN approve";
        assertEquals(processor.process(String.format(template, canonical)), processor.process(String.format(template, alias)));

        String flagged = "IF %s == \"7\" THEN approve";
        Finding expected = processor.analyze(String.format(flagged, canonical)).orElseThrow().getFinding().orElseThrow();
        Finding actual = processor.analyze(String.format(flagged, alias)).orElseThrow().getFinding().orElseThrow();
        assertEquals(expected.getType(), actual.getType());
        assertEquals(expected.getMessage(), actual.getMessage());
    }

    @ParameterizedTest
    @DisplayName("Normalizing a normalized line changes nothing")
    @ValueSource(strings = {
            "whenever Order-Total is greater than 10 also isAdmin is yes",
            "IF type of user == x==true",
            "if customerTier is not gold unless userRole equals \"admin\" then approve",
            "IF user_type IS \"admin\" AND user_type IS \"admin\" THEN grant_access"
    })
    void testIdempotence(String line) {
        String once = processor.analyze(line).orElseThrow().getNormalized();
        assertEquals(once, processor.analyze(once).orElseThrow().getNormalized());
    }

    @Test
    @DisplayName("Full normalization combines keyword, variable and literal passes")
    void testFullNormalization() {
        assertEquals("IF order_total > 10 AND is_user_admin == TRUE",
                processor.analyze("whenever Order-Total is greater than 10 also isAdmin is yes").orElseThrow().getNormalized());
    }

    private static LogicDetector recordingDetector(FindingType type, List<FindingType> consulted, boolean fires) {
        return new LogicDetector() {
            @Override
            public FindingType getType() {
                return type;
            }

            @Override
            public Optional<Finding> detect(String normalizedLine, String originalLine) {
                consulted.add(type);
                return fires ? Optional.of(Finding.contradiction(originalLine)) : Optional.empty();
            }
        };
    }
}
