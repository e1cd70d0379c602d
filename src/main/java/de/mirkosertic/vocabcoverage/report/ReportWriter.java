package de.mirkosertic.vocabcoverage.report;

import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders an {@link AnalysisResult} into one output format.
 */
public interface ReportWriter {

    ReportFormat format();

    void write(AnalysisResult result, Writer out) throws IOException;

    /**
     * Writes the report as UTF-8 into {@code target}, creating missing parent directories
     * and replacing an existing file.
     */
    default void write(final AnalysisResult result, final Path target) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(result, out);
        }
    }
}
