package de.mirkosertic.vocabcoverage.analysis;

import java.util.List;

/**
 * Splits raw text into word tokens.
 *
 * <p>Returned tokens are never empty and always contain at least one letter; tokens made only of
 * digits, punctuation or symbols are dropped here so the normalizer never sees them.</p>
 */
public interface WordTokenizer {

    List<String> tokenize(String text);
}
