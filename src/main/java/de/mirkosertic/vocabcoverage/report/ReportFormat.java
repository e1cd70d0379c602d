package de.mirkosertic.vocabcoverage.report;

import java.util.Locale;

public enum ReportFormat {

    /** The ranked words, one per line. */
    CSV("_top_words.csv"),
    /** Human readable analysis report. */
    SUMMARY("_analysis.txt"),
    /** Everything in machine readable form. */
    JSON("_coverage.json");

    private final String fileSuffix;

    ReportFormat(final String fileSuffix) {
        this.fileSuffix = fileSuffix;
    }

    public String getFileSuffix() {
        return fileSuffix;
    }

    /**
     * @param baseName input file name without extension
     */
    public String defaultFileName(final String baseName) {
        return baseName + fileSuffix;
    }

    /**
     * @param curveStep rank interval of the cumulative coverage lines in the summary
     */
    public ReportWriter createWriter(final int curveStep) {
        return switch (this) {
            case CSV -> new WordListCsvWriter();
            case SUMMARY -> new SummaryReportWriter(curveStep);
            case JSON -> new JsonReportWriter();
        };
    }

    public static ReportFormat parse(final String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value + " (expected csv, summary or json)", e);
        }
    }
}
