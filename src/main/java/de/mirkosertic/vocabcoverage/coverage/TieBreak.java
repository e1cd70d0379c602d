package de.mirkosertic.vocabcoverage.coverage;

import java.util.Locale;

/**
 * Order of keys with equal counts in a ranking.
 */
public enum TieBreak {

    /**
     * Keys seen earlier in the token stream rank first.
     */
    FIRST_SEEN,

    /**
     * Keys are compared with {@link String#compareTo(String)}, i.e. by UTF-16 code units.
     */
    LEXICOGRAPHIC;

    /**
     * Parses {@code first-seen}, {@code first_seen}, {@code lexicographic} ignoring case.
     */
    public static TieBreak parse(final String value) {
        final String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (final TieBreak tieBreak : values()) {
            if (tieBreak.name().equals(normalized)) {
                return tieBreak;
            }
        }
        throw new IllegalArgumentException("Unknown tie-break: " + value + ". Supported: first-seen, lexicographic");
    }
}
