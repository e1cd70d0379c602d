package de.mirkosertic.vocabcoverage.coverage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable mapping from canonical key to its occurrence count.
 *
 * <p>Iteration order is the order in which keys were first seen in the token stream.
 * Tables produced by {@link #merge(FrequencyTable)} lose that order; their keys are kept
 * in lexicographic order instead and {@link #hasFirstSeenOrder()} returns {@code false}.</p>
 *
 * <p>Invariant: {@link #totalOccurrences()} is the sum of all counts.</p>
 */
public final class FrequencyTable {

    private static final FrequencyTable EMPTY = new FrequencyTable(Map.of(), 0, true);

    private final Map<String, Long> counts;
    private final long totalOccurrences;
    private final boolean firstSeenOrder;

    private FrequencyTable(final Map<String, Long> counts, final long totalOccurrences, final boolean firstSeenOrder) {
        this.counts = counts;
        this.totalOccurrences = totalOccurrences;
        this.firstSeenOrder = firstSeenOrder;
    }

    /**
     * Wraps an already counted map. The map must iterate in first-seen order.
     */
    static FrequencyTable ofFirstSeen(final LinkedHashMap<String, Long> counts) {
        return of(counts, true);
    }

    private static FrequencyTable of(final Map<String, Long> counts, final boolean firstSeenOrder) {
        if (counts.isEmpty()) {
            return firstSeenOrder ? EMPTY : new FrequencyTable(Map.of(), 0, false);
        }
        long total = 0;
        for (final Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() <= 0) {
                throw new IllegalArgumentException("Count for key '" + entry.getKey() + "' must be positive");
            }
            total += entry.getValue();
        }
        return new FrequencyTable(Collections.unmodifiableMap(new LinkedHashMap<>(counts)), total, firstSeenOrder);
    }

    public static FrequencyTable empty() {
        return EMPTY;
    }

    /**
     * Combines the counts of two tables. The operation is associative and commutative;
     * the result is ordered lexicographically so that the merge order never shows in it.
     */
    public FrequencyTable merge(final FrequencyTable other) {
        final TreeMap<String, Long> merged = new TreeMap<>(counts);
        for (final Map.Entry<String, Long> entry : other.counts.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
        return of(merged, false);
    }

    /**
     * @return the count of the key, or 0 if it was never seen
     */
    public long count(final String key) {
        return counts.getOrDefault(key, 0L);
    }

    public boolean contains(final String key) {
        return counts.containsKey(key);
    }

    public long totalOccurrences() {
        return totalOccurrences;
    }

    public int distinctKeys() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * @return {@code true} if iteration order reflects the order keys were first seen
     */
    public boolean hasFirstSeenOrder() {
        return firstSeenOrder;
    }

    public Set<String> keys() {
        return counts.keySet();
    }

    /**
     * Read-only view of the counts in table order.
     */
    public Map<String, Long> asMap() {
        return counts;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FrequencyTable)) {
            return false;
        }
        final FrequencyTable that = (FrequencyTable) o;
        return counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "FrequencyTable[distinct=" + counts.size() + ", total=" + totalOccurrences + "]";
    }
}
