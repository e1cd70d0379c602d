package de.mirkosertic.vocabcoverage.stats;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Estimates the syllables of a word as the number of its vowels.
 *
 * <p>The vowel set is language specific and comes from configuration. The word is lowercased
 * before counting, so the set only needs lowercase vowels.</p>
 */
public class SyllableCounter {

    /**
     * Russian vowels.
     */
    public static final String DEFAULT_VOWELS = "аеёиоуыэюя";

    private final Set<Integer> vowels;

    public SyllableCounter(final String vowels) {
        final Set<Integer> codePoints = new HashSet<>();
        vowels.toLowerCase(Locale.ROOT).codePoints().forEach(codePoints::add);
        this.vowels = Set.copyOf(codePoints);
    }

    public static SyllableCounter russian() {
        return new SyllableCounter(DEFAULT_VOWELS);
    }

    public int countSyllables(final String word) {
        if (word == null || word.isEmpty()) {
            return 0;
        }
        return (int) word.toLowerCase(Locale.ROOT).codePoints().filter(vowels::contains).count();
    }
}
