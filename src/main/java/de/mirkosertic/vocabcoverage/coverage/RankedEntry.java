package de.mirkosertic.vocabcoverage.coverage;

/**
 * A canonical key at its position in the frequency ranking.
 *
 * @param key   the canonical key
 * @param count number of occurrences
 * @param rank  1-based position, highest count first
 */
public record RankedEntry(String key, long count, int rank) {
}
