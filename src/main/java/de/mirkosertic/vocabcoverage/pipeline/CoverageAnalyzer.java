package de.mirkosertic.vocabcoverage.pipeline;

import de.mirkosertic.vocabcoverage.analysis.WordTokenizer;
import de.mirkosertic.vocabcoverage.coverage.CoverageCalculator;
import de.mirkosertic.vocabcoverage.coverage.CoverageReport;
import de.mirkosertic.vocabcoverage.coverage.FrequencyCounter;
import de.mirkosertic.vocabcoverage.coverage.FrequencyTable;
import de.mirkosertic.vocabcoverage.coverage.RankedEntry;
import de.mirkosertic.vocabcoverage.coverage.Ranker;
import de.mirkosertic.vocabcoverage.coverage.TokenNormalizer;
import de.mirkosertic.vocabcoverage.document.ExtractedDocument;
import de.mirkosertic.vocabcoverage.morphology.MorphologyProvider;
import de.mirkosertic.vocabcoverage.stats.LemmaForms;
import de.mirkosertic.vocabcoverage.stats.PartOfSpeechDistribution;
import de.mirkosertic.vocabcoverage.stats.SurfaceStatistics;
import de.mirkosertic.vocabcoverage.stats.SyllableCounter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Runs the coverage engine over a text.
 *
 * <p>Tokens are normalized and counted in a single pass. The same pass counts the lowercased
 * surface words, which feed the statistics that do not depend on the normalization policy
 * (word lengths, syllables, POS distribution, lemma forms). Each run starts from fresh counters,
 * so analysing the same text twice gives equal results.</p>
 */
public class CoverageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CoverageAnalyzer.class);

    private final AnalysisSettings settings;
    private final WordTokenizer tokenizer;
    private final TokenNormalizer normalizer;
    private final @Nullable MorphologyProvider morphologyProvider;
    private final Ranker ranker;
    private final SyllableCounter syllableCounter;

    /**
     * @throws IllegalStateException if the settings ask for lemmas and no provider is given
     */
    public CoverageAnalyzer(final AnalysisSettings settings,
                            final WordTokenizer tokenizer,
                            final @Nullable MorphologyProvider morphologyProvider) {
        this.settings = settings;
        this.tokenizer = tokenizer;
        this.morphologyProvider = morphologyProvider;
        this.normalizer = new TokenNormalizer(settings.policy(), morphologyProvider);
        this.ranker = new Ranker(settings.tieBreak());
        this.syllableCounter = new SyllableCounter(settings.syllableVowels());
    }

    public AnalysisSettings getSettings() {
        return settings;
    }

    public AnalysisResult analyze(final ExtractedDocument document) {
        final String expected = settings.expectedLanguage();
        final String detected = document.detectedLanguage();
        if (expected != null && detected != null && !expected.equalsIgnoreCase(detected)) {
            logger.warn("Detected language '{}' of {} differs from the configured language '{}'",
                    detected, document.source(), expected);
        }
        final Path fileName = document.source().getFileName();
        return analyze(fileName != null ? fileName.toString() : document.source().toString(),
                document.content(), detected);
    }

    public AnalysisResult analyze(final String source, final String text, final @Nullable String detectedLanguage) {
        final long tokenizeStart = System.currentTimeMillis();
        final List<String> tokens = tokenizer.tokenize(text);
        logger.debug("Tokenized {} into {} tokens in {} ms", source, tokens.size(),
                System.currentTimeMillis() - tokenizeStart);
        return analyzeTokens(source, tokens, detectedLanguage);
    }

    /**
     * Analyses tokens that were already produced by a tokenizer.
     *
     * @throws IllegalArgumentException if a token contains no letter
     * @throws de.mirkosertic.vocabcoverage.coverage.NormalizationException if lemmatization fails
     */
    public AnalysisResult analyzeTokens(final String source,
                                        final Iterable<String> tokens,
                                        final @Nullable String detectedLanguage) {
        final long countStart = System.currentTimeMillis();
        final FrequencyCounter.Accumulator canonical = new FrequencyCounter.Accumulator();
        final FrequencyCounter.Accumulator surface = new FrequencyCounter.Accumulator();
        for (final String token : tokens) {
            final String key = normalizer.normalize(token);
            surface.add(token.toLowerCase(Locale.ROOT));
            if (key != null) {
                canonical.add(key);
            }
        }
        final FrequencyTable table = canonical.toTable();
        final FrequencyTable surfaceTable = surface.toTable();
        logger.info("Counted {} tokens of {}: {} kept, {} distinct keys in {} ms", surface.added(), source,
                table.totalOccurrences(), table.distinctKeys(), System.currentTimeMillis() - countStart);

        if (surfaceTable.isEmpty()) {
            logger.warn("No words found in {}", source);
        } else if (table.isEmpty()) {
            logger.warn("All {} words of {} were excluded as stopwords", surfaceTable.totalOccurrences(), source);
        }

        final List<RankedEntry> ranking = ranker.rank(table);

        final Double targetPercentage = settings.targetPercentage();
        final CoverageReport percentageReport = targetPercentage == null
                ? null
                : CoverageCalculator.coverageToPercentage(ranking, table.totalOccurrences(), targetPercentage);
        final CoverageReport countReport = settings.targetWords() <= 0
                ? null
                : CoverageCalculator.coverageToCount(ranking, table.totalOccurrences(), settings.targetWords());
        if (percentageReport != null) {
            logger.info("{} keys cover {}% of {}", percentageReport.size(),
                    String.format(Locale.ROOT, "%.2f", percentageReport.coverageReached()), source);
        }

        final long statsStart = System.currentTimeMillis();
        final SurfaceStatistics surfaceStatistics =
                SurfaceStatistics.of(surfaceTable, syllableCounter, settings.longestWords());
        final PartOfSpeechDistribution partsOfSpeech = morphologyProvider == null
                ? PartOfSpeechDistribution.empty()
                : PartOfSpeechDistribution.of(surfaceTable, morphologyProvider);
        final LemmaForms lemmaForms = settings.policy().lemmatize()
                ? LemmaForms.of(topKeys(percentageReport, countReport), surfaceTable, normalizer)
                : LemmaForms.empty();
        logger.debug("Computed statistics for {} in {} ms", source, System.currentTimeMillis() - statsStart);

        return new AnalysisResult(source, detectedLanguage, settings.policy(), ranker.getTieBreak(), table, ranking,
                percentageReport, countReport, surfaceStatistics, partsOfSpeech, lemmaForms);
    }

    private static List<String> topKeys(final @Nullable CoverageReport percentageReport,
                                        final @Nullable CoverageReport countReport) {
        if (countReport != null) {
            return countReport.keys();
        }
        return percentageReport != null ? percentageReport.keys() : List.of();
    }
}
