package de.mirkosertic.vocabcoverage.morphology;

import org.jspecify.annotations.Nullable;

/**
 * The single analysis chosen for a word.
 *
 * @param lemma        dictionary form
 * @param partOfSpeech POS label, {@code null} if unknown
 */
public record MorphologicalAnalysis(String lemma, @Nullable String partOfSpeech) {
}
