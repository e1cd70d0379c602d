package de.mirkosertic.vocabcoverage.report.dto;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of an analysis run.
 */
public record CoverageDocument(
        String source,
        @Nullable String detectedLanguage,
        String generator,
        Settings settings,
        long totalOccurrences,
        int distinctKeys,
        @Nullable CoverageSection percentageCoverage,
        @Nullable CoverageSection countCoverage,
        Statistics statistics,
        Map<String, Long> partsOfSpeech,
        Map<String, List<String>> lemmaForms
) {

    public record Settings(
            boolean lemmatize,
            boolean excludeStopwords,
            int stopwordCount,
            String tieBreak
    ) {
    }

    public record CoverageSection(
            String mode,
            double target,
            double coverageReached,
            List<Point> points
    ) {
    }

    public record Point(int rank, String key, long count, double cumulativePercentage) {
    }

    public record Statistics(
            long totalWords,
            int uniqueWords,
            double vocabularyRichness,
            double averageWordLength,
            long totalSyllables,
            double averageSyllables,
            List<String> longestWords
    ) {
    }
}
