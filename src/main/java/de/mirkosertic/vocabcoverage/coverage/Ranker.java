package de.mirkosertic.vocabcoverage.coverage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders a {@link FrequencyTable} by count, highest first.
 *
 * <p>Ties are resolved by the configured {@link TieBreak}. Tables without a first-seen order
 * (see {@link FrequencyTable#merge(FrequencyTable)}) are always resolved lexicographically.</p>
 */
public final class Ranker {

    private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESCENDING =
            Comparator.comparing(Map.Entry<String, Long>::getValue).reversed();

    private final TieBreak tieBreak;

    public Ranker(final TieBreak tieBreak) {
        this.tieBreak = tieBreak;
    }

    public TieBreak getTieBreak() {
        return tieBreak;
    }

    public List<RankedEntry> rank(final FrequencyTable table) {
        final List<Map.Entry<String, Long>> entries = new ArrayList<>(table.asMap().entrySet());

        // List.sort is stable, so FIRST_SEEN only needs the count comparison on a first-seen ordered table
        if (tieBreak == TieBreak.LEXICOGRAPHIC || !table.hasFirstSeenOrder()) {
            entries.sort(BY_COUNT_DESCENDING.thenComparing(Map.Entry.comparingByKey()));
        } else {
            entries.sort(BY_COUNT_DESCENDING);
        }

        final List<RankedEntry> ranking = new ArrayList<>(entries.size());
        int rank = 1;
        for (final Map.Entry<String, Long> entry : entries) {
            ranking.add(new RankedEntry(entry.getKey(), entry.getValue(), rank++));
        }
        return List.copyOf(ranking);
    }
}
