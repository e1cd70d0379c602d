package de.mirkosertic.vocabcoverage.coverage;

import de.mirkosertic.vocabcoverage.morphology.MorphologyProvider;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Maps a token to its canonical key.
 *
 * <p>Steps, in order: lowercase ({@link Locale#ROOT}), replace with the provider's lemma if
 * lemmatization is enabled, drop the occurrence if the key is a stopword. The stopword check
 * runs on the final key, so a stopword also removes every inflected form that lemmatizes to it.</p>
 */
public class TokenNormalizer {

    private final NormalizationPolicy policy;
    private final @Nullable MorphologyProvider morphologyProvider;

    /**
     * @throws IllegalStateException if the policy asks for lemmas but no provider is given
     */
    public TokenNormalizer(final NormalizationPolicy policy, final @Nullable MorphologyProvider morphologyProvider) {
        if (policy.lemmatize() && morphologyProvider == null) {
            throw new IllegalStateException("Lemmatization is enabled but no morphology provider is configured");
        }
        this.policy = policy;
        this.morphologyProvider = morphologyProvider;
    }

    public NormalizationPolicy getPolicy() {
        return policy;
    }

    /**
     * @param token a token containing at least one letter
     * @return the canonical key, or {@code null} if the occurrence is dropped as a stopword
     * @throws IllegalArgumentException if the token contains no letter
     * @throws NormalizationException   if the morphology provider fails
     */
    public @Nullable String normalize(final String token) {
        if (!containsLetter(token)) {
            throw new IllegalArgumentException("Token without letters must be filtered before normalization: '" + token + "'");
        }

        String key = token.toLowerCase(Locale.ROOT);
        if (policy.lemmatize()) {
            key = lemmatize(key);
        }
        if (policy.excludeStopwords() && policy.stopwords().contains(key)) {
            return null;
        }
        return key;
    }

    private String lemmatize(final String word) {
        final String lemma;
        try {
            lemma = morphologyProvider.lemmaOf(word);
        } catch (final RuntimeException e) {
            throw new NormalizationException(word, e);
        }
        if (lemma == null || lemma.isBlank()) {
            throw new NormalizationException(word, new IllegalStateException("Morphology provider returned no lemma"));
        }
        return lemma.toLowerCase(Locale.ROOT);
    }

    static boolean containsLetter(final String token) {
        if (token == null) {
            return false;
        }
        for (int i = 0; i < token.length(); ) {
            final int codePoint = token.codePointAt(i);
            if (Character.isLetter(codePoint)) {
                return true;
            }
            i += Character.charCount(codePoint);
        }
        return false;
    }
}
