package de.mirkosertic.vocabcoverage.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.vocabcoverage.config.BuildInfo;
import de.mirkosertic.vocabcoverage.coverage.CoverageReport;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;
import de.mirkosertic.vocabcoverage.report.dto.CoverageDocument;
import de.mirkosertic.vocabcoverage.stats.SurfaceStatistics;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.Writer;

/**
 * Serializes the whole result with Jackson. Reports that were not requested are left out.
 */
public class JsonReportWriter implements ReportWriter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public void write(final AnalysisResult result, final Writer out) throws IOException {
        OBJECT_MAPPER.writeValue(out, toDocument(result));
    }

    static CoverageDocument toDocument(final AnalysisResult result) {
        final SurfaceStatistics stats = result.surfaceStatistics();
        return new CoverageDocument(
                result.source(),
                result.detectedLanguage(),
                BuildInfo.describe(),
                new CoverageDocument.Settings(
                        result.policy().lemmatize(),
                        result.policy().excludeStopwords(),
                        result.policy().stopwords().size(),
                        result.tieBreak().name()),
                result.totalOccurrences(),
                result.distinctKeys(),
                toSection(result.percentageReport()),
                toSection(result.countReport()),
                new CoverageDocument.Statistics(
                        stats.totalWords(),
                        stats.uniqueWords(),
                        stats.vocabularyRichness(),
                        stats.averageWordLength(),
                        stats.totalSyllables(),
                        stats.averageSyllables(),
                        stats.longestWords()),
                result.partsOfSpeech().counts(),
                result.lemmaForms().forms());
    }

    private static CoverageDocument.@Nullable CoverageSection toSection(final @Nullable CoverageReport report) {
        if (report == null) {
            return null;
        }
        return new CoverageDocument.CoverageSection(
                report.target().mode().name(),
                report.target().value(),
                report.coverageReached(),
                report.points().stream()
                        .map(p -> new CoverageDocument.Point(p.rank(), p.key(), p.count(), p.cumulativePercentage()))
                        .toList());
    }
}
