package de.mirkosertic.vocabcoverage.config;

import de.mirkosertic.vocabcoverage.coverage.NormalizationPolicy;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    private static InputStream yaml(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Defaults should count surface forms and cover 80 percent")
    void shouldHaveSensibleDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getLanguage()).isEqualTo("ru");
        assertThat(config.isUseLemmas()).isFalse();
        assertThat(config.isExcludeStopwords()).isTrue();
        assertThat(config.getTieBreak()).isEqualTo(TieBreak.FIRST_SEEN);
        assertThat(config.getTargetPercentage()).isEqualTo(80.0);
        assertThat(config.getTargetWords()).isEqualTo(100);
        assertThat(config.getCurveStep()).isEqualTo(10);
        assertThat(config.getMaxContentLength()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should read all sections from YAML")
    void shouldReadYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                vocabcoverage:
                  analysis:
                    language: de
                    use-lemmas: true
                    exclude-stopwords: false
                    stopwords: [der, Die, das]
                    tie-break: lexicographic
                    syllable-vowels: aeiouäöü
                  coverage:
                    target-percentage: 95
                    target-words: 500
                    curve-step: 50
                    longest-words: 5
                  morphology:
                    model-directory: /opt/models
                    pos-model: /opt/models/pos.bin
                    cache-size: 1000
                  extraction:
                    max-content-length: 1000000
                    detect-language: false
                """));

        assertThat(config.getLanguage()).isEqualTo("de");
        assertThat(config.isUseLemmas()).isTrue();
        assertThat(config.isExcludeStopwords()).isFalse();
        assertThat(config.getStopwords()).containsExactly("der", "Die", "das");
        assertThat(config.getTieBreak()).isEqualTo(TieBreak.LEXICOGRAPHIC);
        assertThat(config.getSyllableVowels()).isEqualTo("aeiouäöü");
        assertThat(config.getTargetPercentage()).isEqualTo(95.0);
        assertThat(config.getTargetWords()).isEqualTo(500);
        assertThat(config.getCurveStep()).isEqualTo(50);
        assertThat(config.getLongestWords()).isEqualTo(5);
        assertThat(config.getModelDirectory()).isEqualTo("/opt/models");
        assertThat(config.getPosModel()).isEqualTo("/opt/models/pos.bin");
        assertThat(config.getLemmatizerModel()).isNull();
        assertThat(config.getMorphologyCacheSize()).isEqualTo(1000);
        assertThat(config.getMaxContentLength()).isEqualTo(1_000_000);
        assertThat(config.isDetectLanguage()).isFalse();
    }

    @Test
    @DisplayName("Should ignore documents without the vocabcoverage root")
    void shouldIgnoreForeignYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("other:\n  key: value\n"));

        assertThat(config.getLanguage()).isEqualTo("ru");
    }

    @Nested
    @DisplayName("Variable resolution")
    class Variables {

        @Test
        @DisplayName("Should use the default when the variable is not set")
        void shouldUseDefault() {
            assertThat(ApplicationConfig.resolveVariables("${VOCABCOVERAGE_TEST_UNSET_VARIABLE:/tmp/models}"))
                    .isEqualTo("/tmp/models");
            assertThat(ApplicationConfig.resolveVariables("${VOCABCOVERAGE_TEST_UNSET_VARIABLE:}")).isEmpty();
        }

        @Test
        @DisplayName("Should resolve system properties")
        void shouldResolveSystemProperties() {
            System.setProperty("vocabcoverage.test.dir", "/data");
            try {
                assertThat(ApplicationConfig.resolveVariables("${vocabcoverage.test.dir:/x}/models"))
                        .isEqualTo("/data/models");
            } finally {
                System.clearProperty("vocabcoverage.test.dir");
            }
        }

        @Test
        @DisplayName("Should leave plain values alone")
        void shouldLeavePlainValues() {
            assertThat(ApplicationConfig.resolveVariables("/plain/path")).isEqualTo("/plain/path");
        }
    }

    @Nested
    @DisplayName("Stopwords")
    class Stopwords {

        @Test
        @DisplayName("Should merge configured stopwords with the stopwords file")
        void shouldMergeStopwordsFile() throws Exception {
            final Path file = tempDir.resolve("stopwords.txt");
            Files.write(file, List.of("# Russian stopwords", "и", "", "  в  ", "не"), StandardCharsets.UTF_8);
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    vocabcoverage:
                      analysis:
                        stopwords: [ее]
                    """));
            config.setStopwordsFile(file.toString());

            assertThat(config.resolveStopwords()).containsExactly("ее", "и", "в", "не");
        }

        @Test
        @DisplayName("Should fail for an unreadable stopwords file")
        void shouldFailForMissingFile() {
            final ApplicationConfig config = ApplicationConfig.defaults();
            config.setStopwordsFile(tempDir.resolve("missing.txt").toString());

            assertThatThrownBy(config::resolveStopwords).isInstanceOf(UncheckedIOException.class);
        }

        @Test
        @DisplayName("Should build the normalization policy from the flags")
        void shouldBuildPolicy() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    vocabcoverage:
                      analysis:
                        use-lemmas: true
                        stopwords: [И]
                    """));

            final NormalizationPolicy policy = config.toNormalizationPolicy();

            assertThat(policy.lemmatize()).isTrue();
            assertThat(policy.excludeStopwords()).isTrue();
            assertThat(policy.stopwords()).containsExactly("и");
        }
    }

    @Test
    @DisplayName("Loading should pick up the bundled application.yaml")
    void shouldLoadBundledDefaults() {
        final ApplicationConfig config = ApplicationConfig.load();

        assertThat(config.getStopwords()).contains("ее");
        assertThat(config.getModelDirectory()).isNotBlank();
    }
}
