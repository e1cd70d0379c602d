package de.mirkosertic.vocabcoverage.document;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

public record ExtractedDocument(
        Path source,
        String content,
        @Nullable String detectedLanguage,
        String fileType,
        long fileSize
) {
}
