package de.mirkosertic.vocabcoverage.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer producing the word tokens of a text.
 *
 * <p>Chain: {@code StandardTokenizer → LetterRequiringFilter}. {@link StandardTokenizer} splits on
 * Unicode word boundaries (UAX#29), which handles Cyrillic, Latin and most alphabetic scripts.
 * Case is left untouched; lowercasing belongs to the normalizer.</p>
 */
public class WordAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        final TokenStream stream = new LetterRequiringFilter(tokenizer);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
