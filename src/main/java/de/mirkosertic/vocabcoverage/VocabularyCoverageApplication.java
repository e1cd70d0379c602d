package de.mirkosertic.vocabcoverage;

import com.beust.jcommander.ParameterException;
import de.mirkosertic.vocabcoverage.analysis.LuceneWordTokenizer;
import de.mirkosertic.vocabcoverage.config.ApplicationConfig;
import de.mirkosertic.vocabcoverage.config.BuildInfo;
import de.mirkosertic.vocabcoverage.config.LoggingConfigurator;
import de.mirkosertic.vocabcoverage.document.DocumentReader;
import de.mirkosertic.vocabcoverage.document.ExtractedDocument;
import de.mirkosertic.vocabcoverage.document.TikaDocumentReader;
import de.mirkosertic.vocabcoverage.morphology.OpenNLPMorphologyProvider;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisSettings;
import de.mirkosertic.vocabcoverage.pipeline.CoverageAnalyzer;
import de.mirkosertic.vocabcoverage.report.ConsoleTablePrinter;
import de.mirkosertic.vocabcoverage.report.ReportFormat;
import de.mirkosertic.vocabcoverage.report.ReportWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry point of the vocabulary coverage analyzer.
 * Reads one document, prints the ranked word table to stdout and writes the requested reports.
 */
public class VocabularyCoverageApplication {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyCoverageApplication.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ApplicationConfig config;
    private final CommandLineOptions options;
    private final DocumentReader documentReader;
    private final PrintStream out;

    public VocabularyCoverageApplication(final ApplicationConfig config,
                                         final CommandLineOptions options,
                                         final DocumentReader documentReader,
                                         final PrintStream out) {
        this.config = config;
        this.options = options;
        this.documentReader = documentReader;
        this.out = out;
    }

    /**
     * Runs one analysis.
     *
     * @return the written report files by format
     * @throws IOException if the input cannot be read or a report cannot be written
     */
    public Map<ReportFormat, Path> run() throws IOException {
        final AnalysisSettings settings = options.toSettings(config);

        final Path input = options.getInput();
        logger.info("Reading {}", input);
        final long readStart = System.currentTimeMillis();
        final ExtractedDocument document = documentReader.read(input);
        logger.info("Extracted {} characters ({}, language {}) in {} ms", document.content().length(),
                document.fileType(), document.detectedLanguage(), System.currentTimeMillis() - readStart);

        final OpenNLPMorphologyProvider morphology = settings.policy().lemmatize() ? loadMorphology() : null;

        final AnalysisResult result;
        try (final LuceneWordTokenizer tokenizer = new LuceneWordTokenizer()) {
            final CoverageAnalyzer analyzer = new CoverageAnalyzer(settings, tokenizer, morphology);
            result = analyzer.analyze(document);
        }
        if (morphology != null) {
            logger.info("Morphology cache: {}", morphology.getStats().describe());
        }

        new ConsoleTablePrinter(out).print(result);

        final Map<ReportFormat, Path> written = new LinkedHashMap<>();
        for (final ReportFormat format : options.getFormats()) {
            final ReportWriter writer = format.createWriter(config.getCurveStep());
            final Path target = options.resolveOutput(format);
            writer.write(result, target);
            logger.info("Wrote {} report to {}", format, target);
            written.put(format, target);
        }

        out.println();
        written.forEach((format, path) -> out.println("Saved " + format.name().toLowerCase(Locale.ROOT) + " report to: " + path));
        return written;
    }

    private OpenNLPMorphologyProvider loadMorphology() {
        return OpenNLPMorphologyProvider.load(
                config.getLanguage(),
                toPath(config.getModelDirectory()),
                toPath(config.getPosModel()),
                toPath(config.getLemmatizerModel()),
                config.getMorphologyCacheSize());
    }

    private static @Nullable Path toPath(final @Nullable String value) {
        return value == null || value.isBlank() ? null : Paths.get(value);
    }

    public static void main(final String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    /**
     * Parses the arguments, configures logging and runs the analysis.
     *
     * @return the process exit status
     */
    static int execute(final String[] args, final PrintStream out, final PrintStream err) {
        final CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (final ParameterException e) {
            err.println("Error: " + e.getMessage());
            err.println(CommandLineOptions.usage());
            return EXIT_USAGE;
        }

        if (options.isHelp()) {
            out.println(CommandLineOptions.usage());
            return 0;
        }
        if (options.isVersion()) {
            out.println(BuildInfo.describe());
            return 0;
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(options.isLogToFile() || LoggingConfigurator.fileModeRequested());

        try {
            final ApplicationConfig config = ApplicationConfig.load();
            options.applyTo(config);

            final VocabularyCoverageApplication app = new VocabularyCoverageApplication(
                    config, options, new TikaDocumentReader(config), out);
            app.run();
            return 0;
        } catch (final Exception e) {
            logger.error("Analysis failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
