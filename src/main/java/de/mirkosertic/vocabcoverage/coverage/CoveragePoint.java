package de.mirkosertic.vocabcoverage.coverage;

/**
 * One step of a coverage walk.
 *
 * @param rank                 1-based rank of the key
 * @param key                  the canonical key
 * @param count                occurrences of the key
 * @param cumulativePercentage share of all occurrences covered by the keys up to and including this rank (0-100)
 */
public record CoveragePoint(int rank, String key, long count, double cumulativePercentage) {
}
