package de.mirkosertic.vocabcoverage.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.vocabcoverage.analysis.LuceneWordTokenizer;
import de.mirkosertic.vocabcoverage.coverage.NormalizationPolicy;
import de.mirkosertic.vocabcoverage.morphology.MorphologyProvider;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisResult;
import de.mirkosertic.vocabcoverage.pipeline.AnalysisSettings;
import de.mirkosertic.vocabcoverage.pipeline.CoverageAnalyzer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Report writer Tests")
class ReportWritersTest {

    @TempDir
    Path tempDir;

    static AnalysisResult surfaceResult;
    static AnalysisResult lemmaResult;

    @BeforeAll
    static void analyze() {
        try (final LuceneWordTokenizer tokenizer = new LuceneWordTokenizer()) {
            surfaceResult = new CoverageAnalyzer(AnalysisSettings.defaults(50.0, 20), tokenizer, null)
                    .analyze("sample.txt", "a a b c c c", null);

            final MorphologyProvider provider = mock(MorphologyProvider.class);
            when(provider.lemmaOf(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
            when(provider.lemmaOf("коты")).thenReturn("кот");
            when(provider.partOfSpeechOf(anyString())).thenReturn("NOUN");
            when(provider.partOfSpeechOf("спит")).thenReturn("VERB");
            when(provider.partOfSpeechOf("спят")).thenReturn("VERB");
            final AnalysisSettings settings = AnalysisSettings.defaults(80.0, 20)
                    .withPolicy(new NormalizationPolicy(true, false, Set.of()));
            lemmaResult = new CoverageAnalyzer(settings, tokenizer, provider)
                    .analyze("cats.txt", "Кот спит. Коты спят. Кот", "ru");
        }
    }

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("Should write the words of the primary report one per line")
        void shouldWriteOneWordPerLine() throws Exception {
            final Path target = tempDir.resolve("out").resolve("sample_top_words.csv");

            new WordListCsvWriter().write(surfaceResult, target);

            assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("c\r\n");
        }

        @Test
        @DisplayName("Should quote values containing separators")
        void shouldQuoteSeparators() {
            assertThat(WordListCsvWriter.quote("слово")).isEqualTo("слово");
            assertThat(WordListCsvWriter.quote("a,b")).isEqualTo("\"a,b\"");
            assertThat(WordListCsvWriter.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        }
    }

    @Nested
    @DisplayName("Summary")
    class Summary {

        @Test
        @DisplayName("Should contain totals, coverage and the cumulative curve")
        void shouldContainTotalsAndCoverage() throws Exception {
            final StringWriter out = new StringWriter();

            new SummaryReportWriter(2).write(surfaceResult, out);

            assertThat(out.toString())
                    .contains("=== Text Analysis Results ===")
                    .contains("Source: sample.txt")
                    .contains("Total words: 6")
                    .contains("Unique words: 3")
                    .contains("Vocabulary richness: 50.00%")
                    .contains("Most frequent words:")
                    .contains("  c (3 occurrences)")
                    .contains("Coverage with top 20 words: 100.00%")
                    .contains("Words needed for 50.00%: 1 (reached 50.00%)")
                    .contains("Top   1 words: 50.00%")
                    .contains("Top   2 words: 83.33%")
                    .doesNotContain("Top   3 words")
                    .doesNotContain("Parts of speech distribution:");
        }

        @Test
        @DisplayName("Should list lemma forms and readable POS names")
        void shouldListLemmaFormsAndPartsOfSpeech() throws Exception {
            final StringWriter out = new StringWriter();

            new SummaryReportWriter().write(lemmaResult, out);

            assertThat(out.toString())
                    .contains("Detected language: ru")
                    .contains("Most frequent lemmas (base forms):")
                    .contains("  кот (3 occurrences)")
                    .contains("    Word forms found: кот, коты")
                    .contains("Parts of speech distribution:")
                    .contains("  Noun: 3 (60.0%)")
                    .contains("  Verb: 2 (40.0%)");
        }

        @Test
        @DisplayName("Should keep unknown POS tags as they are")
        void shouldKeepUnknownTags() {
            assertThat(SummaryReportWriter.posName("ADJ")).isEqualTo("Adjective");
            assertThat(SummaryReportWriter.posName("FOO")).isEqualTo("FOO");
        }

        @Test
        @DisplayName("Should reject a non-positive curve step")
        void shouldRejectInvalidCurveStep() {
            assertThatThrownBy(() -> new SummaryReportWriter(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("Should serialize totals, reports and statistics")
        void shouldSerializeResult() throws Exception {
            final Path target = tempDir.resolve("sample_coverage.json");

            new JsonReportWriter().write(surfaceResult, target);

            final JsonNode json = new ObjectMapper().readTree(target.toFile());
            assertThat(json.get("source").asText()).isEqualTo("sample.txt");
            assertThat(json.get("totalOccurrences").asLong()).isEqualTo(6);
            assertThat(json.get("distinctKeys").asInt()).isEqualTo(3);
            assertThat(json.get("settings").get("tieBreak").asText()).isEqualTo("FIRST_SEEN");
            assertThat(json.get("percentageCoverage").get("points")).hasSize(1);
            assertThat(json.get("percentageCoverage").get("points").get(0).get("key").asText()).isEqualTo("c");
            assertThat(json.get("countCoverage").get("mode").asText()).isEqualTo("ITEM_COUNT");
            assertThat(json.get("statistics").get("totalWords").asLong()).isEqualTo(6);
            assertThat(json.has("detectedLanguage")).isFalse();
        }

        @Test
        @DisplayName("Should leave out the percentage section for a top-n run")
        void shouldOmitMissingPercentageSection() throws Exception {
            final AnalysisResult topWords;
            try (final LuceneWordTokenizer tokenizer = new LuceneWordTokenizer()) {
                topWords = new CoverageAnalyzer(AnalysisSettings.defaults(50.0, 20).withTargets(null, 2), tokenizer, null)
                        .analyze("sample.txt", "a a b c c c", null);
            }

            assertThat(JsonReportWriter.toDocument(topWords).percentageCoverage()).isNull();
            assertThat(JsonReportWriter.toDocument(topWords).detectedLanguage()).isNull();

            final StringWriter out = new StringWriter();
            new JsonReportWriter().write(topWords, out);

            final JsonNode json = new ObjectMapper().readTree(out.toString());
            assertThat(json.has("percentageCoverage")).isFalse();
            assertThat(json.get("countCoverage").get("points")).hasSize(2);
        }

        @Test
        @DisplayName("Should include lemma forms and POS counts")
        void shouldIncludeLemmaForms() throws Exception {
            final StringWriter out = new StringWriter();

            new JsonReportWriter().write(lemmaResult, out);

            final JsonNode json = new ObjectMapper().readTree(out.toString());
            assertThat(json.get("lemmaForms").get("кот")).hasSize(2);
            assertThat(json.get("partsOfSpeech").get("NOUN").asLong()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("ReportFormat")
    class Formats {

        @Test
        @DisplayName("Should derive default file names from the input name")
        void shouldDeriveFileNames() {
            assertThat(ReportFormat.CSV.defaultFileName("book")).isEqualTo("book_top_words.csv");
            assertThat(ReportFormat.SUMMARY.defaultFileName("book")).isEqualTo("book_analysis.txt");
            assertThat(ReportFormat.JSON.defaultFileName("book")).isEqualTo("book_coverage.json");
        }

        @Test
        @DisplayName("Should parse format names ignoring case")
        void shouldParseFormats() {
            assertThat(ReportFormat.parse("Json")).isEqualTo(ReportFormat.JSON);
            assertThatThrownBy(() -> ReportFormat.parse("xml")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should create a writer for each format")
        void shouldCreateWriters() {
            for (final ReportFormat format : ReportFormat.values()) {
                assertThat(format.createWriter(10).format()).isEqualTo(format);
            }
        }
    }

    @Test
    @DisplayName("Console table should list rank, word, count and cumulative percentage")
    void consoleTableShouldListRankedWords() {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        new ConsoleTablePrinter(out).print(surfaceResult);

        final String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed)
                .contains("Analyzing text containing 6 total words (3 unique words)")
                .contains("Words accounting for 50% of the text:")
                .contains("#\tWord\t\tCount\t\tCumulative %")
                .contains("1\tc              3              50.00%");
    }
}
