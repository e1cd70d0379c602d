package de.mirkosertic.vocabcoverage.coverage;

/**
 * Where a coverage walk stops.
 *
 * @param mode  whether {@code value} is a percentage or a number of ranked items
 * @param value the percentage (0-100) or the item count
 */
public record CoverageTarget(Mode mode, double value) {

    public enum Mode {
        /**
         * Stop at the first entry whose cumulative percentage reaches the target.
         */
        PERCENTAGE,
        /**
         * Take a fixed number of top-ranked entries.
         */
        ITEM_COUNT
    }

    public CoverageTarget {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Coverage target must be a number");
        }
    }

    public static CoverageTarget percentage(final double percentage) {
        return new CoverageTarget(Mode.PERCENTAGE, percentage);
    }

    public static CoverageTarget itemCount(final int count) {
        return new CoverageTarget(Mode.ITEM_COUNT, count);
    }

    public int itemCount() {
        return (int) value;
    }

    @Override
    public String toString() {
        return mode == Mode.PERCENTAGE ? value + "%" : "top " + itemCount();
    }
}
