package de.mirkosertic.vocabcoverage;

import com.beust.jcommander.ParameterException;
import de.mirkosertic.vocabcoverage.config.ApplicationConfig;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisSettings;
import de.mirkosertic.vocabcoverage.report.ReportFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandLineOptions Tests")
class CommandLineOptionsTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should accept a single input with defaults")
        void shouldParseInputOnly() {
            final CommandLineOptions options = CommandLineOptions.parse("book.epub");

            assertThat(options.getInput()).isEqualTo(Paths.get("book.epub"));
            assertThat(options.getFormats()).containsExactly(ReportFormat.CSV, ReportFormat.SUMMARY);
            assertThat(options.isHelp()).isFalse();
            assertThat(options.isVersion()).isFalse();
            assertThat(options.isLogToFile()).isFalse();
        }

        @Test
        @DisplayName("Should collect repeated formats in order")
        void shouldCollectFormats() {
            final CommandLineOptions options = CommandLineOptions.parse("-f", "json", "-f", "csv", "book.txt");

            assertThat(options.getFormats()).containsExactly(ReportFormat.JSON, ReportFormat.CSV);
        }

        @Test
        @DisplayName("Help and version do not need an input")
        void helpAndVersionNeedNoInput() {
            assertThat(CommandLineOptions.parse("--help").isHelp()).isTrue();
            assertThat(CommandLineOptions.parse("--version").isVersion()).isTrue();
        }

        @Test
        @DisplayName("Should require exactly one input")
        void shouldRequireOneInput() {
            assertThatThrownBy(() -> CommandLineOptions.parse())
                    .isInstanceOf(ParameterException.class)
                    .hasMessageContaining("Exactly one input file");
            assertThatThrownBy(() -> CommandLineOptions.parse("a.txt", "b.txt"))
                    .isInstanceOf(ParameterException.class);
        }

        @Test
        @DisplayName("Should reject invalid percentages")
        void shouldRejectInvalidPercentage() {
            assertThatThrownBy(() -> CommandLineOptions.parse("-p", "abc", "book.txt"))
                    .isInstanceOf(ParameterException.class);
            assertThatThrownBy(() -> CommandLineOptions.parse("-p", "NaN", "book.txt"))
                    .isInstanceOf(ParameterException.class);
            assertThatThrownBy(() -> CommandLineOptions.parse("-p", "0", "book.txt"))
                    .isInstanceOf(ParameterException.class);
        }

        @Test
        @DisplayName("Should reject a non-positive word count")
        void shouldRejectWordCount() {
            assertThatThrownBy(() -> CommandLineOptions.parse("-n", "0", "book.txt"))
                    .isInstanceOf(ParameterException.class);
        }

        @Test
        @DisplayName("Should reject unknown formats and tie-breaks")
        void shouldRejectUnknownValues() {
            assertThatThrownBy(() -> CommandLineOptions.parse("-f", "xml", "book.txt"))
                    .isInstanceOf(ParameterException.class);
            assertThatThrownBy(() -> CommandLineOptions.parse("--tie-break", "random", "book.txt"))
                    .isInstanceOf(ParameterException.class);
        }

        @Test
        @DisplayName("Should reject --lemmas together with --no-lemmas")
        void shouldRejectConflictingLemmaFlags() {
            assertThatThrownBy(() -> CommandLineOptions.parse("--lemmas", "--no-lemmas", "book.txt"))
                    .isInstanceOf(ParameterException.class)
                    .hasMessageContaining("mutually exclusive");
        }

        @Test
        @DisplayName("Usage should list the options")
        void usageShouldListOptions() {
            assertThat(CommandLineOptions.usage())
                    .contains(CommandLineOptions.PROGRAM_NAME)
                    .contains("--percentage")
                    .contains("--lemmas");
        }
    }

    @Nested
    @DisplayName("Configuration overrides")
    class Overrides {

        @Test
        @DisplayName("Given options should override the configuration")
        void shouldApplyOptions() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            final CommandLineOptions options = CommandLineOptions.parse(
                    "-p", "95", "-n", "250", "--lemmas", "--keep-stopwords", "--tie-break", "lexicographic",
                    "--language", "de", "--model-dir", "/models", "book.txt");

            options.applyTo(config);

            assertThat(config.getTargetPercentage()).isEqualTo(95.0);
            assertThat(config.getTargetWords()).isEqualTo(250);
            assertThat(config.isUseLemmas()).isTrue();
            assertThat(config.isExcludeStopwords()).isFalse();
            assertThat(config.getTieBreak()).isEqualTo(TieBreak.LEXICOGRAPHIC);
            assertThat(config.getLanguage()).isEqualTo("de");
            assertThat(config.getModelDirectory()).isEqualTo("/models");
        }

        @Test
        @DisplayName("Absent options should keep the configuration")
        void shouldKeepConfiguration() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            config.setUseLemmas(true);

            CommandLineOptions.parse("book.txt").applyTo(config);

            assertThat(config.isUseLemmas()).isTrue();
            assertThat(config.getTargetPercentage()).isEqualTo(80.0);
        }

        @Test
        @DisplayName("--no-lemmas should switch off configured lemmatization")
        void noLemmasShouldWin() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            config.setUseLemmas(true);

            CommandLineOptions.parse("--no-lemmas", "book.txt").applyTo(config);

            assertThat(config.isUseLemmas()).isFalse();
        }

        @Test
        @DisplayName("Only -n should skip the percentage report")
        void wordsOnlyShouldSkipPercentage() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            final CommandLineOptions options = CommandLineOptions.parse("-n", "50", "book.txt");
            options.applyTo(config);

            final AnalysisSettings settings = options.toSettings(config);

            assertThat(settings.targetPercentage()).isNull();
            assertThat(settings.targetWords()).isEqualTo(50);
        }

        @Test
        @DisplayName("Without -n the configured percentage is used")
        void shouldUseConfiguredPercentage() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            final CommandLineOptions options = CommandLineOptions.parse("book.txt");

            final AnalysisSettings settings = options.toSettings(config);

            assertThat(settings.targetPercentage()).isEqualTo(80.0);
            assertThat(settings.targetWords()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("Output files")
    class Output {

        @Test
        @DisplayName("Reports should default to the directory of the input")
        void shouldDefaultToInputDirectory() {
            final CommandLineOptions options = CommandLineOptions.parse("/books/war_and_peace.epub");

            assertThat(options.resolveOutput(ReportFormat.CSV))
                    .isEqualTo(Paths.get("/books/war_and_peace_top_words.csv").toAbsolutePath());
        }

        @Test
        @DisplayName("Reports should go to the output directory if given")
        void shouldUseOutputDirectory() {
            final CommandLineOptions options = CommandLineOptions.parse("-o", "/out", "/books/anna.txt");

            assertThat(options.resolveOutput(ReportFormat.SUMMARY)).isEqualTo(Path.of("/out", "anna_analysis.txt"));
            assertThat(options.resolveOutput(ReportFormat.JSON)).isEqualTo(Path.of("/out", "anna_coverage.json"));
        }

        @Test
        @DisplayName("Files without extension keep their full name as base")
        void shouldHandleMissingExtension() {
            final CommandLineOptions options = CommandLineOptions.parse("-o", "/out", "README");

            assertThat(options.resolveOutput(ReportFormat.CSV)).isEqualTo(Path.of("/out", "README_top_words.csv"));
        }
    }
}
