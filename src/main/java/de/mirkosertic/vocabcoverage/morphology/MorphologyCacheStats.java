package de.mirkosertic.vocabcoverage.morphology;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Locale;

/**
 * Snapshot of the morphology cache taken from Caffeine's own statistics.
 *
 * @param hits      lookups answered from the cache
 * @param misses    lookups that required tagging and lemmatizing the token
 * @param evictions entries dropped because the cache was full
 * @param size      entries held when the snapshot was taken
 */
public record MorphologyCacheStats(long hits, long misses, long evictions, long size) {

    static MorphologyCacheStats of(final CacheStats stats, final long size) {
        return new MorphologyCacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), size);
    }

    public long requests() {
        return hits + misses;
    }

    /**
     * @return hit rate in percent, 0 before the first lookup
     */
    public double hitRatePercent() {
        final long requests = requests();
        return requests == 0 ? 0.0 : hits * 100.0 / requests;
    }

    public String describe() {
        return String.format(Locale.ROOT, "%d lookups, %d tagged, %.1f%% from cache, %d cached, %d evicted",
                requests(), misses, hitRatePercent(), size, evictions);
    }
}
