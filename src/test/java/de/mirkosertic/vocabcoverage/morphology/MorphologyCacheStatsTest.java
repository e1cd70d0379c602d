package de.mirkosertic.vocabcoverage.morphology;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MorphologyCacheStats Tests")
class MorphologyCacheStatsTest {

    @Test
    @DisplayName("Hit rate should be 0 before the first lookup")
    void hitRateShouldBeZeroWithoutLookups() {
        final MorphologyCacheStats stats = MorphologyCacheStats.of(CacheStats.empty(), 0);

        assertThat(stats.requests()).isZero();
        assertThat(stats.hitRatePercent()).isZero();
    }

    @Test
    @DisplayName("Should take hits, misses and evictions from Caffeine")
    void shouldCopyCaffeineFigures() {
        final CacheStats caffeine = CacheStats.of(30, 10, 10, 0, 5_000, 4, 4);

        final MorphologyCacheStats stats = MorphologyCacheStats.of(caffeine, 6);

        assertThat(stats.hits()).isEqualTo(30);
        assertThat(stats.misses()).isEqualTo(10);
        assertThat(stats.evictions()).isEqualTo(4);
        assertThat(stats.size()).isEqualTo(6);
        assertThat(stats.requests()).isEqualTo(40);
        assertThat(stats.hitRatePercent()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Description should list all figures")
    void descriptionShouldListFigures() {
        final MorphologyCacheStats stats = new MorphologyCacheStats(3, 1, 0, 1);

        assertThat(stats.describe()).isEqualTo("4 lookups, 1 tagged, 75.0% from cache, 1 cached, 0 evicted");
    }
}
