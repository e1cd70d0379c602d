package de.mirkosertic.vocabcoverage.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link WordTokenizer} running a Lucene {@link Analyzer} over the text.
 */
public class LuceneWordTokenizer implements WordTokenizer, AutoCloseable {

    private static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public LuceneWordTokenizer() {
        this(new WordAnalyzer());
    }

    public LuceneWordTokenizer(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD_NAME, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // StringReader input, only reachable through a broken analyzer
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
