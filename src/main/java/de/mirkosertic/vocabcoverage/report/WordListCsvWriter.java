package de.mirkosertic.vocabcoverage.report;

import de.mirkosertic.vocabcoverage.coverage.CoveragePoint;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the keys of the primary coverage report, one per line and in rank order.
 * Keys containing a comma, a quote or a line break are quoted.
 */
public class WordListCsvWriter implements ReportWriter {

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public void write(final AnalysisResult result, final Writer out) throws IOException {
        for (final CoveragePoint point : result.primaryReport().points()) {
            out.write(quote(point.key()));
            out.write("\r\n");
        }
    }

    static String quote(final String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
