package de.mirkosertic.vocabcoverage.config;

import de.mirkosertic.vocabcoverage.coverage.NormalizationPolicy;
import de.mirkosertic.vocabcoverage.coverage.TieBreak;
import de.mirkosertic.vocabcoverage.stats.SyllableCounter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central configuration for the vocabulary coverage analyzer.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line options (applied by the caller through the setters)
 * 2. Environment variables
 * 3. System properties
 * 4. User config file (~/.vocabcoverage/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_LANGUAGE = "VOCABCOVERAGE_LANGUAGE";
    private static final String ENV_MODEL_DIR = "VOCABCOVERAGE_MODEL_DIR";
    private static final String PROP_MODEL_DIR = "vocabcoverage.model.dir";
    private static final String CONFIG_DIR = ".vocabcoverage";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Analysis settings
    private String language = "ru";
    private boolean useLemmas = false;
    private boolean excludeStopwords = true;
    private List<String> stopwords = new ArrayList<>();
    private @Nullable String stopwordsFile;
    private TieBreak tieBreak = TieBreak.FIRST_SEEN;
    private String syllableVowels = SyllableCounter.DEFAULT_VOWELS;

    // Coverage settings
    private double targetPercentage = 80.0;
    private int targetWords = 100;
    private int curveStep = 10;
    private int longestWords = 10;

    // Morphology settings
    private @Nullable String modelDirectory;
    private @Nullable String posModel;
    private @Nullable String lemmatizerModel;
    private int morphologyCacheSize = 200_000;

    // Extraction settings
    private long maxContentLength = -1;
    private boolean detectLanguage = true;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: language={}, useLemmas={}, excludeStopwords={}, stopwords={}, tieBreak={}",
                config.language, config.useLemmas, config.excludeStopwords, config.stopwords.size(), config.tieBreak);

        return config;
    }

    /**
     * Built-in defaults only, without classpath, user file or environment. Used by tests.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    /**
     * Configuration from a single YAML document. Used by tests and for explicit config files.
     */
    public static ApplicationConfig fromYaml(final InputStream yamlStream) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlStream);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("vocabcoverage");
        if (root == null) {
            return;
        }

        final Map<String, Object> analysisConfig = (Map<String, Object>) root.get("analysis");
        if (analysisConfig != null) {
            applyAnalysisConfig(analysisConfig);
        }

        final Map<String, Object> coverageConfig = (Map<String, Object>) root.get("coverage");
        if (coverageConfig != null) {
            applyCoverageConfig(coverageConfig);
        }

        final Map<String, Object> morphologyConfig = (Map<String, Object>) root.get("morphology");
        if (morphologyConfig != null) {
            applyMorphologyConfig(morphologyConfig);
        }

        final Map<String, Object> extractionConfig = (Map<String, Object>) root.get("extraction");
        if (extractionConfig != null) {
            if (extractionConfig.containsKey("max-content-length")) {
                this.maxContentLength = ((Number) extractionConfig.get("max-content-length")).longValue();
            }
            if (extractionConfig.containsKey("detect-language")) {
                this.detectLanguage = (Boolean) extractionConfig.get("detect-language");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAnalysisConfig(final Map<String, Object> analysisConfig) {
        if (analysisConfig.containsKey("language")) {
            this.language = analysisConfig.get("language").toString();
        }
        if (analysisConfig.containsKey("use-lemmas")) {
            this.useLemmas = (Boolean) analysisConfig.get("use-lemmas");
        }
        if (analysisConfig.containsKey("exclude-stopwords")) {
            this.excludeStopwords = (Boolean) analysisConfig.get("exclude-stopwords");
        }
        if (analysisConfig.containsKey("stopwords")) {
            final Object words = analysisConfig.get("stopwords");
            if (words instanceof List) {
                this.stopwords = new ArrayList<>();
                for (final Object word : (List<Object>) words) {
                    this.stopwords.add(word.toString());
                }
            }
        }
        if (analysisConfig.containsKey("stopwords-file")) {
            final Object file = analysisConfig.get("stopwords-file");
            this.stopwordsFile = file == null ? null : resolveVariables(file.toString());
        }
        if (analysisConfig.containsKey("tie-break")) {
            this.tieBreak = TieBreak.parse(analysisConfig.get("tie-break").toString());
        }
        if (analysisConfig.containsKey("syllable-vowels")) {
            this.syllableVowels = analysisConfig.get("syllable-vowels").toString();
        }
    }

    private void applyCoverageConfig(final Map<String, Object> coverageConfig) {
        if (coverageConfig.containsKey("target-percentage")) {
            this.targetPercentage = ((Number) coverageConfig.get("target-percentage")).doubleValue();
        }
        if (coverageConfig.containsKey("target-words")) {
            this.targetWords = ((Number) coverageConfig.get("target-words")).intValue();
        }
        if (coverageConfig.containsKey("curve-step")) {
            this.curveStep = ((Number) coverageConfig.get("curve-step")).intValue();
        }
        if (coverageConfig.containsKey("longest-words")) {
            this.longestWords = ((Number) coverageConfig.get("longest-words")).intValue();
        }
    }

    private void applyMorphologyConfig(final Map<String, Object> morphologyConfig) {
        final Object dir = morphologyConfig.get("model-directory");
        if (dir != null) {
            this.modelDirectory = resolveVariables(dir.toString());
        }
        final Object pos = morphologyConfig.get("pos-model");
        if (pos != null) {
            this.posModel = resolveVariables(pos.toString());
        }
        final Object lemmas = morphologyConfig.get("lemmatizer-model");
        if (lemmas != null) {
            this.lemmatizerModel = resolveVariables(lemmas.toString());
        }
        if (morphologyConfig.containsKey("cache-size")) {
            this.morphologyCacheSize = ((Number) morphologyConfig.get("cache-size")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envLanguage = System.getenv(ENV_LANGUAGE);
        if (envLanguage != null && !envLanguage.trim().isEmpty()) {
            this.language = envLanguage.trim();
            logger.info("Language from environment: {}", this.language);
        }

        final String propModelDir = System.getProperty(PROP_MODEL_DIR);
        if (propModelDir != null && !propModelDir.isEmpty()) {
            this.modelDirectory = propModelDir;
        }

        final String envModelDir = System.getenv(ENV_MODEL_DIR);
        if (envModelDir != null && !envModelDir.trim().isEmpty()) {
            this.modelDirectory = envModelDir.trim();
            logger.info("Model directory from environment: {}", this.modelDirectory);
        }

        // Default model directory if not set
        if (this.modelDirectory == null || this.modelDirectory.isEmpty()) {
            this.modelDirectory = getConfigDirectory().resolve("models").toString();
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Stopwords from the configured list and, if set, the stopwords file (one word per line,
     * {@code #} starts a comment).
     *
     * @throws UncheckedIOException if the stopwords file cannot be read
     */
    public Set<String> resolveStopwords() {
        final Set<String> result = new LinkedHashSet<>(stopwords);
        if (stopwordsFile != null && !stopwordsFile.isBlank()) {
            final Path path = Paths.get(stopwordsFile);
            try {
                for (final String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                    final String word = line.strip();
                    if (!word.isEmpty() && !word.startsWith("#")) {
                        result.add(word);
                    }
                }
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to read stopwords file: " + path, e);
            }
        }
        return result;
    }

    public NormalizationPolicy toNormalizationPolicy() {
        return new NormalizationPolicy(useLemmas, excludeStopwords, resolveStopwords());
    }

    // Getters and setters for command line overrides
    public String getLanguage() {
        return language;
    }

    public void setLanguage(final String language) {
        this.language = language;
    }

    public boolean isUseLemmas() {
        return useLemmas;
    }

    public void setUseLemmas(final boolean useLemmas) {
        this.useLemmas = useLemmas;
    }

    public boolean isExcludeStopwords() {
        return excludeStopwords;
    }

    public void setExcludeStopwords(final boolean excludeStopwords) {
        this.excludeStopwords = excludeStopwords;
    }

    public List<String> getStopwords() {
        return stopwords;
    }

    public @Nullable String getStopwordsFile() {
        return stopwordsFile;
    }

    public void setStopwordsFile(final @Nullable String stopwordsFile) {
        this.stopwordsFile = stopwordsFile;
    }

    public TieBreak getTieBreak() {
        return tieBreak;
    }

    public void setTieBreak(final TieBreak tieBreak) {
        this.tieBreak = tieBreak;
    }

    public String getSyllableVowels() {
        return syllableVowels;
    }

    public double getTargetPercentage() {
        return targetPercentage;
    }

    public void setTargetPercentage(final double targetPercentage) {
        this.targetPercentage = targetPercentage;
    }

    public int getTargetWords() {
        return targetWords;
    }

    public void setTargetWords(final int targetWords) {
        this.targetWords = targetWords;
    }

    public int getCurveStep() {
        return curveStep;
    }

    public int getLongestWords() {
        return longestWords;
    }

    public @Nullable String getModelDirectory() {
        return modelDirectory;
    }

    public void setModelDirectory(final @Nullable String modelDirectory) {
        this.modelDirectory = modelDirectory;
    }

    public @Nullable String getPosModel() {
        return posModel;
    }

    public @Nullable String getLemmatizerModel() {
        return lemmatizerModel;
    }

    public int getMorphologyCacheSize() {
        return morphologyCacheSize;
    }

    public long getMaxContentLength() {
        return maxContentLength;
    }

    public boolean isDetectLanguage() {
        return detectLanguage;
    }
}
