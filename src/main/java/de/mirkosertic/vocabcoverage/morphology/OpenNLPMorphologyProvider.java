package de.mirkosertic.vocabcoverage.morphology;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import opennlp.tools.lemmatizer.LemmatizerModel;
import opennlp.tools.postag.POSModel;
import org.apache.lucene.analysis.opennlp.tools.NLPLemmatizerOp;
import org.apache.lucene.analysis.opennlp.tools.NLPPOSTaggerOp;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * {@link MorphologyProvider} backed by OpenNLP Universal Dependencies models.
 *
 * <p>Each word is tagged as a one-word sentence with the POS tagger, then lemmatized with the
 * lemmatizer using that tag. Only the best tag sequence and the best lemma are kept, so a word
 * always gets exactly one analysis. Lemmas the model cannot produce ({@code O}, {@code _} or
 * blank) fall back to the word itself.</p>
 *
 * <p>Analyses are cached per word with Caffeine. Because a word is always analysed without
 * context, cached and uncached answers are identical and the provider stays deterministic
 * within a run. The OpenNLP ops are not thread-safe and are only used under a lock.</p>
 */
public class OpenNLPMorphologyProvider implements MorphologyProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenNLPMorphologyProvider.class);

    /**
     * Maps language code to the Universal Dependencies treebank used in the model file names.
     */
    private static final Map<String, String> TREEBANK_BY_LANGUAGE = Map.of(
            "en", "ewt",
            "de", "gsd",
            "ru", "gsd",
            "fr", "gsd",
            "it", "vit",
            "es", "gsd"
    );

    /**
     * Model version embedded in the OpenNLP model file names.
     */
    public static final String MODEL_VERSION = "1.2-2.5.0";

    public static final int DEFAULT_CACHE_SIZE = 200_000;

    private static final Set<String> NO_LEMMA = Set.of("O", "_");

    private final NLPPOSTaggerOp posTagger;
    private final NLPLemmatizerOp lemmatizer;
    private final Cache<String, MorphologicalAnalysis> cache;
    private final Object lock = new Object();

    public OpenNLPMorphologyProvider(final NLPPOSTaggerOp posTagger,
                                     final NLPLemmatizerOp lemmatizer,
                                     final int maxCacheSize) {
        this.posTagger = posTagger;
        this.lemmatizer = lemmatizer;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCacheSize)
                .recordStats()
                .build();
    }

    /**
     * Loads the POS and lemmatizer models for a language.
     *
     * <p>Each model is looked up in {@code modelDirectory} first and on the classpath second, under
     * the OpenNLP naming scheme {@code opennlp-<lang>-ud-<treebank>-<type>-<version>.bin}.
     * Explicit model paths, when given, take precedence.</p>
     *
     * @throws MorphologyException if the language is not supported or a model is missing or unreadable
     */
    public static OpenNLPMorphologyProvider load(final String languageCode,
                                                 final @Nullable Path modelDirectory,
                                                 final @Nullable Path posModelPath,
                                                 final @Nullable Path lemmatizerModelPath,
                                                 final int maxCacheSize) {
        final String treebank = TREEBANK_BY_LANGUAGE.get(languageCode);
        if (treebank == null && (posModelPath == null || lemmatizerModelPath == null)) {
            throw new MorphologyException(
                    "Unsupported language for OpenNLP lemmatization: " + languageCode
                            + ". Supported: " + TREEBANK_BY_LANGUAGE.keySet()
                            + ". Configure explicit model paths for other languages.");
        }

        final long start = System.currentTimeMillis();
        try (final InputStream posStream = openModel(posModelPath, modelDirectory, languageCode, treebank, "pos");
             final InputStream lemmaStream = openModel(lemmatizerModelPath, modelDirectory, languageCode, treebank, "lemmas")) {
            final POSModel posModel = new POSModel(posStream);
            final LemmatizerModel lemmatizerModel = new LemmatizerModel(lemmaStream);
            final OpenNLPMorphologyProvider provider = new OpenNLPMorphologyProvider(
                    new NLPPOSTaggerOp(posModel),
                    new NLPLemmatizerOp(null, lemmatizerModel),
                    maxCacheSize);
            logger.info("Loaded OpenNLP models for language '{}' in {} ms", languageCode,
                    System.currentTimeMillis() - start);
            return provider;
        } catch (final IOException e) {
            throw new MorphologyException("Failed to load OpenNLP models for language: " + languageCode, e);
        }
    }

    static String modelFileName(final String languageCode, final String treebank, final String type) {
        return "opennlp-" + languageCode + "-ud-" + treebank + "-" + type + "-" + MODEL_VERSION + ".bin";
    }

    private static InputStream openModel(final @Nullable Path explicitPath,
                                         final @Nullable Path modelDirectory,
                                         final String languageCode,
                                         final @Nullable String treebank,
                                         final String type) throws IOException {
        if (explicitPath != null) {
            if (!Files.isRegularFile(explicitPath)) {
                throw new MorphologyException("OpenNLP " + type + " model not found: " + explicitPath);
            }
            return Files.newInputStream(explicitPath);
        }

        final String fileName = modelFileName(languageCode, treebank, type);
        if (modelDirectory != null) {
            final Path candidate = modelDirectory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                logger.debug("Loading {} model from {}", type, candidate);
                return Files.newInputStream(candidate);
            }
        }

        final InputStream stream = OpenNLPMorphologyProvider.class.getResourceAsStream("/" + fileName);
        if (stream == null) {
            throw new MorphologyException(
                    "OpenNLP model not found: " + fileName + " (searched "
                            + (modelDirectory != null ? modelDirectory + " and " : "") + "the classpath)");
        }
        return stream;
    }

    @Override
    public String lemmaOf(final String token) {
        return analyze(token).lemma();
    }

    @Override
    public @Nullable String partOfSpeechOf(final String token) {
        return analyze(token).partOfSpeech();
    }

    /**
     * Returns the cached analysis of the word, computing it on the first request.
     *
     * @throws MorphologyException if tagging or lemmatization fails
     */
    public MorphologicalAnalysis analyze(final String token) {
        return cache.get(token, this::computeAnalysis);
    }

    private MorphologicalAnalysis computeAnalysis(final String token) {
        final String[] words = {token};
        final String[] tags;
        final String[] lemmas;
        try {
            synchronized (lock) {
                tags = posTagger.getPOSTags(words);
                lemmas = lemmatizer.lemmatize(words, tags);
            }
        } catch (final RuntimeException e) {
            throw new MorphologyException("OpenNLP analysis failed for token '" + token + "'", e);
        }

        final String tag = tags != null && tags.length > 0 ? tags[0] : null;
        final String lemma = lemmas != null && lemmas.length > 0 ? lemmas[0] : null;
        return new MorphologicalAnalysis(
                lemma == null || lemma.isBlank() || NO_LEMMA.contains(lemma) ? token : lemma,
                tag == null || tag.isBlank() ? null : tag);
    }

    /**
     * Runs pending cache maintenance first so that size and evictions are current.
     */
    public MorphologyCacheStats getStats() {
        cache.cleanUp();
        return MorphologyCacheStats.of(cache.stats(), cache.estimatedSize());
    }
}
