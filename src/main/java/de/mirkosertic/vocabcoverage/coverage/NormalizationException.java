package de.mirkosertic.vocabcoverage.coverage;

/**
 * Raised when a token cannot be normalized because the morphology provider failed.
 * A run that hits this error aborts; it never falls back to surface-form counting.
 */
public class NormalizationException extends RuntimeException {

    private final String token;

    public NormalizationException(final String token, final Throwable cause) {
        super("Failed to normalize token '" + token + "': " + cause.getMessage(), cause);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
