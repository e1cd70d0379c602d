package de.mirkosertic.vocabcoverage.analysis;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Drops tokens that contain no letter, such as {@code 1999}, {@code 3.14} or {@code --}.
 *
 * <p>Tokens mixing letters and digits ({@code mp3}) pass.</p>
 */
public final class LetterRequiringFilter extends FilteringTokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);

    public LetterRequiringFilter(final TokenStream input) {
        super(input);
    }

    @Override
    protected boolean accept() {
        final char[] buffer = termAtt.buffer();
        final int length = termAtt.length();
        for (int i = 0; i < length; ) {
            final int codePoint = Character.codePointAt(buffer, i, length);
            if (Character.isLetter(codePoint)) {
                return true;
            }
            i += Character.charCount(codePoint);
        }
        return false;
    }
}
