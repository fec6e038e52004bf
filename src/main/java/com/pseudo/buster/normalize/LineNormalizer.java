package com.pseudo.buster.normalize;

import com.pseudo.buster.synonym.SynonymTable;

import java.util.Objects;

/**
 * Composes the keyword, variable and literal passes in their fixed order.
 */
public class LineNormalizer {

    private final KeywordNormalizer keywordNormalizer;
    private final VariableNormalizer variableNormalizer;
    private final LiteralNormalizer literalNormalizer;

    public LineNormalizer(SynonymTable synonymTable) {
        this(new KeywordNormalizer(), new VariableNormalizer(synonymTable), new LiteralNormalizer());
    }

    public LineNormalizer(KeywordNormalizer keywordNormalizer,
                          VariableNormalizer variableNormalizer,
                          LiteralNormalizer literalNormalizer) {
        this.keywordNormalizer = Objects.requireNonNull(keywordNormalizer, "keywordNormalizer");
        this.variableNormalizer = Objects.requireNonNull(variableNormalizer, "variableNormalizer");
        this.literalNormalizer = Objects.requireNonNull(literalNormalizer, "literalNormalizer");
    }

    public String normalize(String line) {
        String result = keywordNormalizer.normalize(line);
        result = variableNormalizer.normalize(result);
        return literalNormalizer.normalize(result);
    }
}
