package de.mirkosertic.vocabcoverage.morphology;

/**
 * Raised when the morphology provider is unavailable or a lookup fails.
 */
public class MorphologyException extends RuntimeException {

    public MorphologyException(final String message) {
        super(message);
    }

    public MorphologyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
