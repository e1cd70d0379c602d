package de.mirkosertic.vocabcoverage.stats;

import de.mirkosertic.vocabcoverage.coverage.FrequencyTable;
import de.mirkosertic.vocabcoverage.coverage.TokenNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Surface forms observed in the text for a set of canonical keys, e.g. the forms
 * {@code шла}, {@code шёл}, {@code идти} of the lemma {@code идти}.
 *
 * @param forms canonical key to its surface forms in first-seen order
 */
public record LemmaForms(Map<String, List<String>> forms) {

    private static final LemmaForms EMPTY = new LemmaForms(Map.of());

    public LemmaForms {
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        forms.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        forms = Collections.unmodifiableMap(copy);
    }

    public static LemmaForms empty() {
        return EMPTY;
    }

    /**
     * Groups the surface words by the key the normalizer maps them to, keeping only the
     * requested keys. Surface words normalized to {@code null} (stopwords) are skipped.
     */
    public static LemmaForms of(final Collection<String> canonicalKeys,
                                final FrequencyTable surfaceTable,
                                final TokenNormalizer normalizer) {
        final Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (final String key : canonicalKeys) {
            grouped.put(key, new LinkedHashSet<>());
        }
        for (final String surface : surfaceTable.keys()) {
            final String key = normalizer.normalize(surface);
            if (key != null) {
                final Set<String> forms = grouped.get(key);
                if (forms != null) {
                    forms.add(surface);
                }
            }
        }

        final Map<String, List<String>> result = new LinkedHashMap<>();
        grouped.forEach((key, forms) -> result.put(key, new ArrayList<>(forms)));
        return new LemmaForms(result);
    }

    public List<String> formsOf(final String key) {
        return forms.getOrDefault(key, List.of());
    }
}
