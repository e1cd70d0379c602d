package de.mirkosertic.vocabcoverage.stats;

import de.mirkosertic.vocabcoverage.coverage.FrequencyTable;
import de.mirkosertic.vocabcoverage.morphology.MorphologyProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrences per part-of-speech label.
 *
 * <p>Each distinct word is tagged once and weighted by its count. Words the provider cannot
 * label are skipped. Labels are ordered by count, highest first, and by first appearance on ties.</p>
 *
 * @param counts label to occurrence count, in ranking order
 */
public record PartOfSpeechDistribution(Map<String, Long> counts) {

    private static final PartOfSpeechDistribution EMPTY = new PartOfSpeechDistribution(Map.of());

    public PartOfSpeechDistribution {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static PartOfSpeechDistribution empty() {
        return EMPTY;
    }

    public static PartOfSpeechDistribution of(final FrequencyTable surfaceTable, final MorphologyProvider provider) {
        final Map<String, Long> byLabel = new LinkedHashMap<>();
        for (final Map.Entry<String, Long> entry : surfaceTable.asMap().entrySet()) {
            final String label = provider.partOfSpeechOf(entry.getKey());
            if (label != null && !label.isBlank()) {
                byLabel.merge(label, entry.getValue(), Long::sum);
            }
        }

        final List<Map.Entry<String, Long>> sorted = new ArrayList<>(byLabel.entrySet());
        sorted.sort(Map.Entry.<String, Long>comparingByValue().reversed());

        final Map<String, Long> ordered = new LinkedHashMap<>();
        for (final Map.Entry<String, Long> entry : sorted) {
            ordered.put(entry.getKey(), entry.getValue());
        }
        return new PartOfSpeechDistribution(ordered);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }
}
