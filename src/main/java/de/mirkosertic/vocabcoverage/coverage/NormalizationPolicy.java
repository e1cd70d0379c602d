package de.mirkosertic.vocabcoverage.coverage;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * How tokens become canonical keys. Lemmatization and stopword exclusion are independent.
 *
 * @param lemmatize        replace each word with its lemma
 * @param excludeStopwords drop keys contained in {@code stopwords}
 * @param stopwords        stopwords, stored lowercased
 */
public record NormalizationPolicy(boolean lemmatize, boolean excludeStopwords, Set<String> stopwords) {

    public NormalizationPolicy {
        final Set<String> lowercased = new LinkedHashSet<>();
        for (final String stopword : stopwords) {
            final String trimmed = stopword.trim();
            if (!trimmed.isEmpty()) {
                lowercased.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        stopwords = Set.copyOf(lowercased);
    }

    /**
     * Lowercasing only.
     */
    public static NormalizationPolicy surfaceForms() {
        return new NormalizationPolicy(false, false, Set.of());
    }

    public NormalizationPolicy withLemmatize(final boolean value) {
        return new NormalizationPolicy(value, excludeStopwords, stopwords);
    }

    public NormalizationPolicy withExcludeStopwords(final boolean value) {
        return new NormalizationPolicy(lemmatize, value, stopwords);
    }
}
