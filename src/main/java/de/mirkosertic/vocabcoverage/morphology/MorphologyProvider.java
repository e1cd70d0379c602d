package de.mirkosertic.vocabcoverage.morphology;

import org.jspecify.annotations.Nullable;

/**
 * Maps a surface word to its dictionary base form and part of speech.
 *
 * <p>Implementations must answer deterministically for a given token within one run.
 * When several analyses are possible, the most likely one is returned. Failures are reported
 * as {@link MorphologyException}; implementations never retry.</p>
 */
public interface MorphologyProvider {

    /**
     * @param token a lowercased word
     * @return the lemma of the word, never {@code null}; the word itself if no lemma is known
     * @throws MorphologyException if the lookup failed
     */
    String lemmaOf(String token);

    /**
     * @param token a lowercased word
     * @return the part-of-speech label, or {@code null} if the provider has none for it
     * @throws MorphologyException if the lookup failed
     */
    @Nullable
    String partOfSpeechOf(String token);
}
