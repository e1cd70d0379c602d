package de.mirkosertic.vocabcoverage.document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The input document is missing, unreadable or in a format that cannot be parsed.
 */
public class DocumentReadException extends IOException {

    private final Path path;

    public DocumentReadException(final Path path, final String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public DocumentReadException(final Path path, final String message, final Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
