package de.mirkosertic.vocabcoverage.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Counts canonical keys into a {@link FrequencyTable}.
 *
 * <p>Input must already be normalized: stopwords dropped and no {@code null} values.</p>
 */
public final class FrequencyCounter {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyCounter.class);

    private FrequencyCounter() {
    }

    public static FrequencyTable count(final Iterable<String> canonicalKeys) {
        final Accumulator accumulator = new Accumulator();
        for (final String key : canonicalKeys) {
            accumulator.add(key);
        }
        return accumulator.toTable();
    }

    /**
     * Counts each chunk on the given executor and merges the partial tables.
     *
     * <p>The merged table has no first-seen order, so rankings derived from it break ties
     * lexicographically.</p>
     *
     * @throws CompletionException if counting a chunk failed; chunks still pending are cancelled
     */
    public static FrequencyTable countInParallel(final List<? extends List<String>> chunks,
                                                 final ExecutorService executor) {
        final List<Future<FrequencyTable>> futures = new ArrayList<>(chunks.size());
        for (final List<String> chunk : chunks) {
            futures.add(executor.submit(() -> count(chunk)));
        }

        FrequencyTable result = null;
        for (final Future<FrequencyTable> future : futures) {
            final FrequencyTable partial;
            try {
                partial = future.get();
            } catch (final InterruptedException e) {
                cancelAll(futures);
                Thread.currentThread().interrupt();
                throw new CompletionException("Interrupted while counting chunks", e);
            } catch (final ExecutionException e) {
                cancelAll(futures);
                throw new CompletionException("Failed to count chunk", e.getCause());
            }
            result = result == null ? partial.merge(FrequencyTable.empty()) : result.merge(partial);
        }
        if (result == null) {
            return FrequencyTable.empty().merge(FrequencyTable.empty());
        }
        logger.debug("Merged {} chunks into {}", chunks.size(), result);
        return result;
    }

    private static void cancelAll(final List<Future<FrequencyTable>> futures) {
        for (final Future<FrequencyTable> future : futures) {
            future.cancel(true);
        }
    }

    /**
     * Single-pass accumulator for streaming use. Not thread-safe.
     */
    public static final class Accumulator {

        private final LinkedHashMap<String, Long> counts = new LinkedHashMap<>();
        private long added;

        public void add(final String canonicalKey) {
            Objects.requireNonNull(canonicalKey, "canonicalKey must not be null");
            counts.merge(canonicalKey, 1L, Long::sum);
            added++;
        }

        public long added() {
            return added;
        }

        public FrequencyTable toTable() {
            return FrequencyTable.ofFirstSeen(counts);
        }
    }
}
