package de.mirkosertic.vocabcoverage.stats;

import de.mirkosertic.vocabcoverage.coverage.FrequencyTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Descriptive statistics over the surface words of a text.
 *
 * <p>Computed from a table of lowercased, unlemmatized words; averages are weighted by
 * occurrence count. All ratios are 0 for an empty table.</p>
 *
 * @param totalWords         number of word occurrences
 * @param uniqueWords        number of distinct words
 * @param vocabularyRichness {@code uniqueWords / totalWords}
 * @param averageWordLength  average length in code points
 * @param totalSyllables     sum of syllables over all occurrences
 * @param averageSyllables   {@code totalSyllables / totalWords}
 * @param longestWords       the longest distinct words, longest first, earlier seen first on ties
 */
public record SurfaceStatistics(
        long totalWords,
        int uniqueWords,
        double vocabularyRichness,
        double averageWordLength,
        long totalSyllables,
        double averageSyllables,
        List<String> longestWords
) {

    public static final int DEFAULT_LONGEST_WORDS = 10;

    public SurfaceStatistics {
        longestWords = List.copyOf(longestWords);
    }

    public static SurfaceStatistics of(final FrequencyTable surfaceTable, final SyllableCounter syllableCounter) {
        return of(surfaceTable, syllableCounter, DEFAULT_LONGEST_WORDS);
    }

    public static SurfaceStatistics of(final FrequencyTable surfaceTable,
                                       final SyllableCounter syllableCounter,
                                       final int longestWordLimit) {
        final long totalWords = surfaceTable.totalOccurrences();
        long totalLength = 0;
        long totalSyllables = 0;
        for (final Map.Entry<String, Long> entry : surfaceTable.asMap().entrySet()) {
            final String word = entry.getKey();
            final long count = entry.getValue();
            totalLength += length(word) * count;
            totalSyllables += syllableCounter.countSyllables(word) * count;
        }

        final List<String> words = new ArrayList<>(surfaceTable.keys());
        // stable sort keeps table order on equal lengths
        words.sort(Comparator.comparingInt(SurfaceStatistics::length).reversed());
        final List<String> longest = words.subList(0, Math.min(Math.max(longestWordLimit, 0), words.size()));

        return new SurfaceStatistics(
                totalWords,
                surfaceTable.distinctKeys(),
                ratio(surfaceTable.distinctKeys(), totalWords),
                ratio(totalLength, totalWords),
                totalSyllables,
                ratio(totalSyllables, totalWords),
                longest
        );
    }

    private static int length(final String word) {
        return word.codePointCount(0, word.length());
    }

    private static double ratio(final long numerator, final long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
