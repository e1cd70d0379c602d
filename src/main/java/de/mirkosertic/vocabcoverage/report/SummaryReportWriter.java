package de.mirkosertic.vocabcoverage.report;

import de.mirkosertic.vocabcoverage.coverage.CoveragePoint;
import de.mirkosertic.vocabcoverage.coverage.CoverageReport;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;
import de.mirkosertic.vocabcoverage.stats.PartOfSpeechDistribution;
import de.mirkosertic.vocabcoverage.stats.SurfaceStatistics;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain text report meant for reading: totals, most frequent keys with the word forms seen for
 * them, POS distribution, coverage and the cumulative coverage curve.
 */
public class SummaryReportWriter implements ReportWriter {

    public static final int DEFAULT_CURVE_STEP = 10;

    private static final Map<String, String> POS_NAMES = Map.ofEntries(
            Map.entry("ADJ", "Adjective"),
            Map.entry("ADP", "Adposition"),
            Map.entry("ADV", "Adverb"),
            Map.entry("AUX", "Auxiliary verb"),
            Map.entry("CCONJ", "Coordinating conjunction"),
            Map.entry("DET", "Determiner"),
            Map.entry("INTJ", "Interjection"),
            Map.entry("NOUN", "Noun"),
            Map.entry("NUM", "Numeral"),
            Map.entry("PART", "Particle"),
            Map.entry("PRON", "Pronoun"),
            Map.entry("PROPN", "Proper noun"),
            Map.entry("PUNCT", "Punctuation"),
            Map.entry("SCONJ", "Subordinating conjunction"),
            Map.entry("SYM", "Symbol"),
            Map.entry("VERB", "Verb"),
            Map.entry("X", "Other")
    );

    private final int curveStep;

    public SummaryReportWriter() {
        this(DEFAULT_CURVE_STEP);
    }

    /**
     * @param curveStep the cumulative coverage is listed for rank 1 and every multiple of this step
     */
    public SummaryReportWriter(final int curveStep) {
        if (curveStep <= 0) {
            throw new IllegalArgumentException("Curve step must be positive: " + curveStep);
        }
        this.curveStep = curveStep;
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.SUMMARY;
    }

    @Override
    public void write(final AnalysisResult result, final Writer out) throws IOException {
        final SurfaceStatistics stats = result.surfaceStatistics();

        line(out, "=== Text Analysis Results ===");
        line(out, "");
        line(out, "Source: " + result.source());
        if (result.detectedLanguage() != null) {
            line(out, "Detected language: " + result.detectedLanguage());
        }
        line(out, "");
        line(out, "Total words: " + stats.totalWords());
        line(out, "Unique words: " + stats.uniqueWords());
        line(out, "Vocabulary richness: " + percent(stats.vocabularyRichness() * 100.0));
        line(out, "Average word length: " + decimal(stats.averageWordLength()) + " characters");
        line(out, "Average syllables per word: " + decimal(stats.averageSyllables()));

        writeMostFrequent(result, out);
        writePartsOfSpeech(result.partsOfSpeech(), stats.totalWords(), out);
        writeCoverage(result, out);

        line(out, "");
        line(out, "Longest words:");
        for (final String word : stats.longestWords()) {
            line(out, "  " + word + " (" + word.codePointCount(0, word.length()) + " characters)");
        }
    }

    private void writeMostFrequent(final AnalysisResult result, final Writer out) throws IOException {
        final CoverageReport report = result.countReport() != null ? result.countReport() : result.percentageReport();
        if (report == null) {
            return;
        }
        line(out, "");
        line(out, result.policy().lemmatize() ? "Most frequent lemmas (base forms):" : "Most frequent words:");
        for (final CoveragePoint point : report.points()) {
            line(out, "  " + point.key() + " (" + point.count() + " occurrences)");
            final List<String> forms = result.lemmaForms().formsOf(point.key());
            if (!forms.isEmpty()) {
                line(out, "    Word forms found: " + String.join(", ", forms));
            }
        }
    }

    private void writePartsOfSpeech(final PartOfSpeechDistribution distribution,
                                    final long totalWords,
                                    final Writer out) throws IOException {
        if (distribution.isEmpty()) {
            return;
        }
        line(out, "");
        line(out, "Parts of speech distribution:");
        for (final Map.Entry<String, Long> entry : distribution.counts().entrySet()) {
            final double share = totalWords == 0 ? 0.0 : entry.getValue() * 100.0 / totalWords;
            line(out, "  " + posName(entry.getKey()) + ": " + entry.getValue()
                    + " (" + String.format(Locale.ROOT, "%.1f%%", share) + ")");
        }
    }

    private void writeCoverage(final AnalysisResult result, final Writer out) throws IOException {
        line(out, "");
        line(out, "Word Coverage Analysis:");
        final CoverageReport countReport = result.countReport();
        final CoverageReport percentageReport = result.percentageReport();
        if (countReport != null) {
            line(out, "  Coverage with top " + countReport.target().itemCount() + " words: "
                    + percent(countReport.coverageReached()));
        }
        if (percentageReport != null) {
            line(out, "  Words needed for " + percent(percentageReport.target().value()) + ": "
                    + percentageReport.size() + " (reached " + percent(percentageReport.coverageReached()) + ")");
        }
        line(out, "  Total unique words: " + result.distinctKeys());
        line(out, "  Total word occurrences: " + result.totalOccurrences());

        if (countReport != null && !countReport.isEmpty()) {
            line(out, "");
            line(out, "Cumulative Coverage by Word Count:");
            for (final CoveragePoint point : countReport.points()) {
                if (point.rank() == 1 || point.rank() % curveStep == 0) {
                    line(out, String.format(Locale.ROOT, "  Top %3d words: %s", point.rank(),
                            percent(point.cumulativePercentage())));
                }
            }
        }
    }

    static String posName(final String tag) {
        return POS_NAMES.getOrDefault(tag, tag);
    }

    private static String percent(final double percentage) {
        return String.format(Locale.ROOT, "%.2f%%", percentage);
    }

    private static String decimal(final double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static void line(final Writer out, final String text) throws IOException {
        out.write(text);
        out.write(System.lineSeparator());
    }
}
