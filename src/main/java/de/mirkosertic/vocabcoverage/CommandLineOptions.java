package de.mirkosertic.vocabcoverage;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import de.mirkosertic.vocabcoverage.config.ApplicationConfig;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisSettings;
import de.mirkosertic.vocabcoverage.report.ReportFormat;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Command line of the analyzer. Options that are given override the loaded configuration.
 */
public class CommandLineOptions {

    public static final String PROGRAM_NAME = "vocabcoverage";

    @Parameter(description = "<input file>")
    private List<String> inputs = new ArrayList<>();

    @Parameter(names = {"-p", "--percentage"}, description = "Target cumulative percentage of all word occurrences",
            converter = DoubleConverter.class, validateWith = PercentageValidator.class)
    private @Nullable Double percentage;

    @Parameter(names = {"-n", "--words"}, description = "Number of top words for the coverage curve",
            validateWith = PositiveInteger.class)
    private @Nullable Integer words;

    @Parameter(names = {"-f", "--format"}, description = "Report formats to write: csv, summary, json",
            converter = ReportFormatConverter.class)
    private List<ReportFormat> formats = new ArrayList<>();

    @Parameter(names = {"-o", "--output"}, description = "Output directory (default: directory of the input file)",
            converter = PathConverter.class)
    private @Nullable Path outputDirectory;

    @Parameter(names = "--lemmas", description = "Count lemmas instead of word forms (needs OpenNLP models)")
    private boolean lemmas;

    @Parameter(names = "--no-lemmas", description = "Count word forms even if the configuration enables lemmas")
    private boolean noLemmas;

    @Parameter(names = "--keep-stopwords", description = "Do not drop stopwords")
    private boolean keepStopwords;

    @Parameter(names = "--stopwords-file", description = "File with one stopword per line")
    private @Nullable String stopwordsFile;

    @Parameter(names = "--tie-break", description = "Order of words with equal counts: first-seen or lexicographic",
            converter = TieBreakConverter.class)
    private @Nullable TieBreak tieBreak;

    @Parameter(names = "--language", description = "Language code of the text, selects the OpenNLP models")
    private @Nullable String language;

    @Parameter(names = "--model-dir", description = "Directory containing the OpenNLP models")
    private @Nullable String modelDirectory;

    @Parameter(names = "--log-to-file", description = "Log into ~/.vocabcoverage/log instead of stderr")
    private boolean logToFile;

    @Parameter(names = "--version", description = "Print the version and exit")
    private boolean version;

    @Parameter(names = {"-h", "--help"}, description = "Show this help", help = true)
    private boolean help;

    /**
     * @throws ParameterException if the arguments are invalid
     */
    public static CommandLineOptions parse(final String... args) {
        final CommandLineOptions options = new CommandLineOptions();
        final JCommander commander = newCommander(options);
        commander.parse(args);
        options.validate();
        return options;
    }

    static JCommander newCommander(final CommandLineOptions options) {
        return JCommander.newBuilder()
                .addObject(options)
                .programName(PROGRAM_NAME)
                .build();
    }

    public static String usage() {
        final StringBuilder out = new StringBuilder();
        newCommander(new CommandLineOptions()).getUsageFormatter().usage(out);
        return out.toString();
    }

    private void validate() {
        if (help || version) {
            return;
        }
        if (inputs.size() != 1) {
            throw new ParameterException("Exactly one input file is required, got " + inputs.size());
        }
        if (lemmas && noLemmas) {
            throw new ParameterException("--lemmas and --no-lemmas are mutually exclusive");
        }
    }

    /**
     * Copies the given options into the configuration.
     */
    public void applyTo(final ApplicationConfig config) {
        if (percentage != null) {
            config.setTargetPercentage(percentage);
        }
        if (words != null) {
            config.setTargetWords(words);
        }
        if (lemmas) {
            config.setUseLemmas(true);
        }
        if (noLemmas) {
            config.setUseLemmas(false);
        }
        if (keepStopwords) {
            config.setExcludeStopwords(false);
        }
        if (stopwordsFile != null) {
            config.setStopwordsFile(stopwordsFile);
        }
        if (tieBreak != null) {
            config.setTieBreak(tieBreak);
        }
        if (language != null) {
            config.setLanguage(language);
        }
        if (modelDirectory != null) {
            config.setModelDirectory(modelDirectory);
        }
    }

    /**
     * Settings for the run. When only {@code -n} is given the word list is the top-n list and
     * no percentage-mode report is computed.
     */
    public AnalysisSettings toSettings(final ApplicationConfig config) {
        final AnalysisSettings settings = AnalysisSettings.from(config);
        if (words != null && percentage == null) {
            return settings.withTargets(null, words);
        }
        return settings;
    }

    public Path getInput() {
        return Paths.get(inputs.get(0));
    }

    /**
     * @return the requested formats, csv and summary when none was given
     */
    public Set<ReportFormat> getFormats() {
        if (formats.isEmpty()) {
            return EnumSet.of(ReportFormat.CSV, ReportFormat.SUMMARY);
        }
        return new LinkedHashSet<>(formats);
    }

    public Path resolveOutput(final ReportFormat format) {
        final Path input = getInput();
        final String fileName = input.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        final Path directory = outputDirectory != null ? outputDirectory : input.toAbsolutePath().getParent();
        return directory.resolve(format.defaultFileName(baseName));
    }

    public boolean isLogToFile() {
        return logToFile;
    }

    public boolean isVersion() {
        return version;
    }

    public boolean isHelp() {
        return help;
    }

    public static class PathConverter implements IStringConverter<Path> {
        @Override
        public Path convert(final String value) {
            return Paths.get(value);
        }
    }

    public static class DoubleConverter implements IStringConverter<Double> {
        @Override
        public Double convert(final String value) {
            try {
                return Double.parseDouble(value);
            } catch (final NumberFormatException e) {
                throw new ParameterException("Not a number: " + value);
            }
        }
    }

    public static class ReportFormatConverter implements IStringConverter<ReportFormat> {
        @Override
        public ReportFormat convert(final String value) {
            try {
                return ReportFormat.parse(value);
            } catch (final IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    public static class TieBreakConverter implements IStringConverter<TieBreak> {
        @Override
        public TieBreak convert(final String value) {
            try {
                return TieBreak.parse(value);
            } catch (final IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    public static class PercentageValidator implements IParameterValidator {
        @Override
        public void validate(final String name, final String value) throws ParameterException {
            final double parsed;
            try {
                parsed = Double.parseDouble(value);
            } catch (final NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " must be a number, got " + value);
            }
            if (Double.isNaN(parsed) || parsed <= 0) {
                throw new ParameterException("Parameter " + name + " must be a positive percentage, got " + value);
            }
        }
    }

    public static class PositiveInteger implements IParameterValidator {
        @Override
        public void validate(final String name, final String value) throws ParameterException {
            final int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (final NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " must be an integer, got " + value);
            }
            if (parsed <= 0) {
                throw new ParameterException("Parameter " + name + " must be positive, got " + value);
            }
        }
    }
}
