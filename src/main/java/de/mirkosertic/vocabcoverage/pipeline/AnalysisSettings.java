package de.mirkosertic.vocabcoverage.pipeline;

import de.mirkosertic.vocabcoverage.config.ApplicationConfig;
import de.mirkosertic.vocabcoverage.coverage.NormalizationPolicy;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import de.mirkosertic.vocabcoverage.stats.SurfaceStatistics;
import de.mirkosertic.vocabcoverage.stats.SyllableCounter;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Settings of one analysis run.
 *
 * @param policy           how tokens become canonical keys
 * @param tieBreak         ranking order among equal counts
 * @param targetPercentage target of the percentage-mode report, {@code null} to skip it
 * @param targetWords      size of the item-count report (the coverage curve), 0 or less to skip it
 * @param longestWords     number of longest words kept in the surface statistics
 * @param syllableVowels   vowel set for syllable counting
 * @param expectedLanguage language the text should be in, compared against detection; may be null
 */
public record AnalysisSettings(
        NormalizationPolicy policy,
        TieBreak tieBreak,
        @Nullable Double targetPercentage,
        int targetWords,
        int longestWords,
        String syllableVowels,
        @Nullable String expectedLanguage
) {

    public AnalysisSettings {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(tieBreak, "tieBreak");
        Objects.requireNonNull(syllableVowels, "syllableVowels");
        if (targetPercentage != null && targetPercentage.isNaN()) {
            throw new IllegalArgumentException("Target percentage must be a number");
        }
    }

    public static AnalysisSettings from(final ApplicationConfig config) {
        return new AnalysisSettings(
                config.toNormalizationPolicy(),
                config.getTieBreak(),
                config.getTargetPercentage(),
                config.getTargetWords(),
                config.getLongestWords(),
                config.getSyllableVowels(),
                config.getLanguage());
    }

    /**
     * Surface forms only, default tie-break, both reports enabled. Handy for tests and embedding.
     */
    public static AnalysisSettings defaults(final double targetPercentage, final int targetWords) {
        return new AnalysisSettings(NormalizationPolicy.surfaceForms(), TieBreak.FIRST_SEEN,
                targetPercentage, targetWords, SurfaceStatistics.DEFAULT_LONGEST_WORDS,
                SyllableCounter.DEFAULT_VOWELS, null);
    }

    public AnalysisSettings withPolicy(final NormalizationPolicy value) {
        return new AnalysisSettings(value, tieBreak, targetPercentage, targetWords, longestWords,
                syllableVowels, expectedLanguage);
    }

    public AnalysisSettings withTieBreak(final TieBreak value) {
        return new AnalysisSettings(policy, value, targetPercentage, targetWords, longestWords,
                syllableVowels, expectedLanguage);
    }

    public AnalysisSettings withTargets(final @Nullable Double percentage, final int words) {
        return new AnalysisSettings(policy, tieBreak, percentage, words, longestWords,
                syllableVowels, expectedLanguage);
    }
}
