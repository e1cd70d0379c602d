package de.mirkosertic.vocabcoverage.pipeline;

import de.mirkosertic.vocabcoverage.coverage.CoverageReport;
import de.mirkosertic.vocabcoverage.coverage.FrequencyTable;
import de.mirkosertic.vocabcoverage.coverage.NormalizationPolicy;
import de.mirkosertic.vocabcoverage.coverage.RankedEntry;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import de.mirkosertic.vocabcoverage.stats.LemmaForms;
import de.mirkosertic.vocabcoverage.stats.PartOfSpeechDistribution;
import de.mirkosertic.vocabcoverage.stats.SurfaceStatistics;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything one run computed for a text.
 *
 * @param source            file name or other description of the analysed text
 * @param detectedLanguage  language reported by the document reader, may be null
 * @param policy            normalization applied to the tokens
 * @param tieBreak          tie-break used for the ranking
 * @param table             canonical key counts
 * @param ranking           full ranking of {@code table}
 * @param percentageReport  percentage-mode report, null if not requested
 * @param countReport       item-count report (coverage curve), null if not requested
 * @param surfaceStatistics statistics over the lowercased surface words
 * @param partsOfSpeech     POS distribution, empty without a morphology provider
 * @param lemmaForms        surface forms per top lemma, empty unless lemmatizing
 */
public record AnalysisResult(
        String source,
        @Nullable String detectedLanguage,
        NormalizationPolicy policy,
        TieBreak tieBreak,
        FrequencyTable table,
        List<RankedEntry> ranking,
        @Nullable CoverageReport percentageReport,
        @Nullable CoverageReport countReport,
        SurfaceStatistics surfaceStatistics,
        PartOfSpeechDistribution partsOfSpeech,
        LemmaForms lemmaForms
) {

    public AnalysisResult {
        ranking = List.copyOf(ranking);
    }

    /**
     * The report the word list is taken from: the percentage-mode report when one was requested,
     * the item-count report otherwise.
     *
     * @throws IllegalStateException if neither report was requested
     */
    public CoverageReport primaryReport() {
        if (percentageReport != null) {
            return percentageReport;
        }
        if (countReport != null) {
            return countReport;
        }
        throw new IllegalStateException("No coverage report was requested for " + source);
    }

    public long totalOccurrences() {
        return table.totalOccurrences();
    }

    public int distinctKeys() {
        return table.distinctKeys();
    }
}
