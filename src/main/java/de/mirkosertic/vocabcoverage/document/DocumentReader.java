package de.mirkosertic.vocabcoverage.document;

import java.nio.file.Path;

/**
 * Extracts the natural-language text of a document, without markup.
 */
public interface DocumentReader {

    /**
     * @throws DocumentReadException if the file does not exist, cannot be read or cannot be parsed
     */
    ExtractedDocument read(Path path) throws DocumentReadException;
}
