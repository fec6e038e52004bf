package com.pseudo.buster.normalize;

import com.pseudo.buster.synonym.IdentifierCanonicalizer;
import com.pseudo.buster.synonym.SynonymTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites identifier aliases in a line to their canonical names.
 *
 * Two passes run in order:
 * - Operand pass: identifiers directly in front of a comparison or logical
 *   operator ({@code ==, !=, >, <, AND, OR, NOT}) are canonicalized through the
 *   synonym table, with the case-style fallback for unregistered names.
 * - Sweep pass: every registered alias anywhere in the line is replaced by its
 *   canonical name, ignoring case.
 *
 * Both passes are idempotent.
 */
public class VariableNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(VariableNormalizer.class);

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_])[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern OPERATOR_AHEAD = Pattern.compile("\\s*(?:==|!=|>|<|(?:AND|OR|NOT)\\b)");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[ \\t\\-]+");
    private static final Pattern HYPHEN_SEPARATOR = Pattern.compile("-+");

    static final Set<String> RESERVED_WORDS = Set.of(
            "IF", "AND", "OR", "NOT", "THEN", "DO", "ELSE", "TRUE", "FALSE");

    // Longest multi-word alias phrase tried in front of an operator
    private static final int MAX_PHRASE_WORDS = 4;

    private final SynonymTable synonymTable;
    private final Pattern aliasSweep;

    public VariableNormalizer(SynonymTable synonymTable) {
        this.synonymTable = Objects.requireNonNull(synonymTable, "synonymTable");
        this.aliasSweep = buildSweepPattern(synonymTable);
    }

    private static Pattern buildSweepPattern(SynonymTable table) {
        List<String> aliases = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : table.getEntries().entrySet()) {
            for (String alias : entry.getValue()) {
                if (!alias.equals(entry.getKey())) {
                    aliases.add(alias);
                }
            }
        }
        if (aliases.isEmpty()) {
            return null;
        }
        String alternation = aliases.stream()
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Runs the operand pass followed by the sweep pass.
     */
    public String normalize(String line) {
        Objects.requireNonNull(line, "line");
        return sweepAliases(normalizeOperands(line));
    }

    /**
     * Canonicalizes the identifiers that directly precede an operator.
     */
    public String normalizeOperands(String line) {
        Objects.requireNonNull(line, "line");
        List<Token> tokens = tokenize(line);
        StringBuilder result = new StringBuilder(line.length());
        int cursor = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (isReserved(token.text) || !precedesOperator(line, token.end)) {
                continue;
            }

            Resolution resolution = resolve(line, tokens, i, firstPhraseToken(line, tokens, i, cursor));
            String original = line.substring(resolution.start, token.end);
            if (!resolution.canonical.equals(original)) {
                logger.debug("Operand '{}' -> '{}'", original, resolution.canonical);
            }

            result.append(line, cursor, resolution.start).append(resolution.canonical);
            cursor = token.end;
        }

        result.append(line, cursor, line.length());
        return result.toString();
    }

    /**
     * Replaces every registered alias with its canonical name.
     */
    public String sweepAliases(String line) {
        Objects.requireNonNull(line, "line");
        if (aliasSweep == null) {
            return line;
        }
        Matcher matcher = aliasSweep.matcher(line);
        StringBuilder result = new StringBuilder(line.length());
        while (matcher.find()) {
            String alias = matcher.group();
            String canonical = synonymTable.lookup(alias).orElse(alias);
            if (!canonical.equals(alias)) {
                logger.debug("Alias '{}' -> '{}'", alias, canonical);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(canonical));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Finds the first token of the candidate phrase ending at token {@code index}:
     * up to {@link #MAX_PHRASE_WORDS} words joined by spaces or hyphens, stopping
     * at reserved words and at text already rewritten.
     */
    private static int firstPhraseToken(String line, List<Token> tokens, int index, int cursor) {
        int first = index;
        while (first > 0 && index - first + 1 < MAX_PHRASE_WORDS) {
            Token previous = tokens.get(first - 1);
            if (previous.start < cursor || isReserved(previous.text)
                    || !separatedBy(WORD_SEPARATOR, line, previous, tokens.get(first))) {
                break;
            }
            first--;
        }
        return first;
    }

    /**
     * Tries the longest registered phrase first. Without a registered match the
     * hyphen-joined identifier ending at the token gets the case-style fallback.
     */
    private Resolution resolve(String line, List<Token> tokens, int index, int first) {
        Token last = tokens.get(index);

        for (int k = first; k <= index; k++) {
            int start = tokens.get(k).start;
            Optional<String> canonical = synonymTable.lookup(line.substring(start, last.end));
            if (canonical.isPresent()) {
                return new Resolution(start, canonical.get());
            }
        }

        int compound = index;
        while (compound > first && separatedBy(HYPHEN_SEPARATOR, line, tokens.get(compound - 1), tokens.get(compound))) {
            compound--;
        }
        int start = tokens.get(compound).start;
        return new Resolution(start, IdentifierCanonicalizer.toSnakeCase(line.substring(start, last.end)));
    }

    private static boolean separatedBy(Pattern separator, String line, Token left, Token right) {
        return separator.matcher(line.substring(left.end, right.start)).matches();
    }

    private static boolean precedesOperator(String line, int position) {
        Matcher matcher = OPERATOR_AHEAD.matcher(line);
        matcher.region(position, line.length());
        return matcher.lookingAt();
    }

    private static boolean isReserved(String word) {
        return RESERVED_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    private static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = IDENTIFIER.matcher(line);
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), matcher.start(), matcher.end()));
        }
        return tokens;
    }

    private static final class Token {
        final String text;
        final int start;
        final int end;

        Token(String text, int start, int end) {
            this.text = text;
            this.start = start;
            this.end = end;
        }
    }

    private static final class Resolution {
        final int start;
        final String canonical;

        Resolution(int start, String canonical) {
            this.start = start;
            this.canonical = canonical;
        }
    }
}
