package de.mirkosertic.vocabcoverage.document;

import de.mirkosertic.vocabcoverage.config.ApplicationConfig;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;

/**
 * Extracts the text of a document using Apache Tika.
 *
 * <p>Tika detects the format, so plain text, HTML, EPUB and the office formats all go through the
 * same code path. Markup, scripts and styles are dropped by the {@link BodyContentHandler}. The text
 * is then normalized (see {@link #normalizeContent(String)}) and optionally language-detected.</p>
 */
public class TikaDocumentReader implements DocumentReader {

    private static final Logger logger = LoggerFactory.getLogger(TikaDocumentReader.class);

    private final long maxContentLength;
    private final Tika tika;
    private final Parser parser;
    private final @Nullable LanguageDetector languageDetector;

    public TikaDocumentReader(final ApplicationConfig config) {
        this(config.getMaxContentLength(), config.isDetectLanguage());
    }

    /**
     * @param maxContentLength maximum number of characters to extract, -1 or 0 for unlimited
     * @param detectLanguage   whether to run language detection on the extracted text
     */
    public TikaDocumentReader(final long maxContentLength, final boolean detectLanguage) {
        this.maxContentLength = maxContentLength;
        this.tika = new Tika();
        this.parser = new AutoDetectParser();
        this.languageDetector = detectLanguage ? new OptimaizeLangDetector().loadModels() : null;
    }

    @Override
    public ExtractedDocument read(final Path file) throws DocumentReadException {
        if (!Files.isRegularFile(file)) {
            throw new DocumentReadException(file, "File not found");
        }
        if (!Files.isReadable(file)) {
            throw new DocumentReadException(file, "File is not readable");
        }

        try {
            final long fileSize = Files.size(file);
            if (fileSize == 0) {
                logger.warn("File is empty: {}", file);
                return new ExtractedDocument(file, "", null, tika.detect(file), 0);
            }

            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

            // -1 means unlimited
            final BodyContentHandler handler = maxContentLength <= 0
                    ? new BodyContentHandler(-1)
                    : new BodyContentHandler((int) Math.min(maxContentLength, Integer.MAX_VALUE));

            final ParseContext context = new ParseContext();
            context.set(Parser.class, parser);

            try (final InputStream stream = TikaInputStream.get(file, metadata)) {
                parser.parse(stream, handler, metadata, context);
            } catch (final SAXException e) {
                if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                    throw new DocumentReadException(file, "Failed to parse document", e);
                }
                logger.warn("Content of {} truncated at {} characters", file, maxContentLength);
            } catch (final TikaException e) {
                throw new DocumentReadException(file, "Failed to parse document", e);
            }

            final String content = normalizeContent(handler.toString());
            logger.debug("Extracted {} characters from file: {}", content.length(), file);

            final String fileType = tika.detect(file);
            final String detectedLanguage = detectLanguage(file, content);

            return new ExtractedDocument(file, content, detectedLanguage, fileType, fileSize);
        } catch (final DocumentReadException e) {
            throw e;
        } catch (final IOException e) {
            throw new DocumentReadException(file, "I/O error reading file", e);
        }
    }

    private @Nullable String detectLanguage(final Path file, final String content) {
        if (languageDetector == null || content.isEmpty()) {
            return null;
        }
        try {
            final LanguageResult result = languageDetector.detect(content);
            if (result.isReasonablyCertain()) {
                return result.getLanguage();
            }
        } catch (final RuntimeException e) {
            logger.warn("Language detection failed for file: {}", file, e);
        }
        return null;
    }

    /**
     * Normalize extracted text so that tokenization sees clean words.
     *
     * <p>Steps applied in order:</p>
     * <ol>
     *   <li>Decoding of HTML entities left over in the text ({@code &amp;}, {@code &#1105;}, ...).</li>
     *   <li>NFKC normalization, which expands ligatures and full-width forms.</li>
     *   <li>Removal of control characters except newline and tab, and of soft hyphens, which
     *       would otherwise split words that were hyphenated for layout.</li>
     *   <li>Replacement of Unicode space variants with an ASCII space.</li>
     *   <li>Collapsing of horizontal whitespace and of blank lines, then trimming.</li>
     * </ol>
     *
     * @param content raw content as returned by Tika; may be null
     * @return the normalized text, empty if the input was null or empty
     */
    static String normalizeContent(final String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }

        String result = decodeHtmlEntities(content);

        result = Normalizer.normalize(result, Normalizer.Form.NFKC);

        // U+0000-U+0008, U+000B-U+000C, U+000E-U+001F, U+007F-U+009F, soft hyphen U+00AD
        result = result.replaceAll("[\u0000-\u0008\u000B\u000C\u000E-\u001F\u007F-\u009F\u00AD]", "");

        // NO-BREAK SPACE, OGHAM SPACE MARK, EN QUAD..ZERO WIDTH SPACE, NARROW NBSP,
        // MEDIUM MATHEMATICAL SPACE, IDEOGRAPHIC SPACE, BOM
        result = result.replaceAll("[\u00A0\u1680\u2000-\u200B\u202F\u205F\u3000\uFEFF]", " ");

        result = result.replaceAll("[\\t ]+", " ");
        result = result.replaceAll(" *\\n *( *\\n *)*", "\n");

        return result.trim();
    }

    private static String decodeHtmlEntities(final String text) {
        if (!text.contains("&")) {
            return text;
        }

        final StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '&') {
                final int semicolon = text.indexOf(';', i + 1);
                if (semicolon > i && semicolon <= i + 10) {
                    final String decoded = decodeEntity(text.substring(i + 1, semicolon));
                    if (decoded != null) {
                        result.append(decoded);
                        i = semicolon + 1;
                        continue;
                    }
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    private static @Nullable String decodeEntity(final String entity) {
        if (entity.isEmpty()) {
            return null;
        }

        if (entity.charAt(0) == '#') {
            try {
                final int codePoint = entity.length() > 1 && (entity.charAt(1) == 'x' || entity.charAt(1) == 'X')
                        ? Integer.parseInt(entity.substring(2), 16)
                        : Integer.parseInt(entity.substring(1), 10);
                if (Character.isValidCodePoint(codePoint)) {
                    return new String(Character.toChars(codePoint));
                }
            } catch (final NumberFormatException e) {
                logger.trace("Not a numeric entity: &{};", entity);
            }
            return null;
        }

        return switch (entity) {
            case "amp" -> "&";
            case "lt" -> "<";
            case "gt" -> ">";
            case "quot" -> "\"";
            case "apos" -> "'";
            case "nbsp" -> " ";
            case "shy" -> "\u00AD";
            case "mdash" -> "—";
            case "ndash" -> "–";
            case "hellip" -> "…";
            case "laquo" -> "«";
            case "raquo" -> "»";
            case "lsquo" -> "‘";
            case "rsquo" -> "’";
            case "ldquo" -> "“";
            case "rdquo" -> "”";
            default -> null;
        };
    }
}
