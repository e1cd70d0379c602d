package de.mirkosertic.vocabcoverage.report;

import de.mirkosertic.vocabcoverage.coverage.CoveragePoint;
import de.mirkosertic.vocabcoverage.coverage.CoverageReport;
import de.mirkosertic.vocabcoverage.coverage.CoverageTarget;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Prints the primary coverage report as a tab separated table.
 */
public class ConsoleTablePrinter {

    private final PrintStream out;

    public ConsoleTablePrinter(final PrintStream out) {
        this.out = out;
    }

    public void print(final AnalysisResult result) {
        final CoverageReport report = result.primaryReport();
        out.printf(Locale.ROOT, "%nAnalyzing text containing %,d total words (%,d unique words)%n",
                result.totalOccurrences(), result.distinctKeys());
        out.println(describe(report.target()));
        out.println();
        out.println("#\tWord\t\tCount\t\tCumulative %");
        out.println("-".repeat(45));
        for (final CoveragePoint point : report.points()) {
            out.printf(Locale.ROOT, "%d\t%-15s%-15d%.2f%%%n",
                    point.rank(), point.key(), point.count(), point.cumulativePercentage());
        }
        out.flush();
    }

    private static String describe(final CoverageTarget target) {
        if (target.mode() == CoverageTarget.Mode.PERCENTAGE) {
            return String.format(Locale.ROOT, "Words accounting for %s%% of the text:", formatNumber(target.value()));
        }
        return "Top " + target.itemCount() + " words:";
    }

    private static String formatNumber(final double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
