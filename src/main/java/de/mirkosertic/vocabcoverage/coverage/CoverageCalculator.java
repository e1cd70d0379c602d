package de.mirkosertic.vocabcoverage.coverage;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a ranking and accumulates the share of all occurrences covered by its top entries.
 *
 * <p>The cumulative percentage after entry <i>i</i> is {@code sum(count[1..i]) * 100.0 / total}.
 * Values are not rounded; formatting is left to the report writers. A total of zero yields an
 * empty report instead of a division.</p>
 */
public final class CoverageCalculator {

    private CoverageCalculator() {
    }

    public static CoverageReport coverage(final List<RankedEntry> ranked,
                                          final long totalOccurrences,
                                          final CoverageTarget target) {
        return switch (target.mode()) {
            case PERCENTAGE -> coverageToPercentage(ranked, totalOccurrences, target.value());
            case ITEM_COUNT -> coverageToCount(ranked, totalOccurrences, target.itemCount());
        };
    }

    /**
     * Convenience overload taking the total from the table the ranking was derived from.
     */
    public static CoverageReport coverage(final List<RankedEntry> ranked,
                                          final FrequencyTable table,
                                          final CoverageTarget target) {
        return coverage(ranked, table.totalOccurrences(), target);
    }

    /**
     * Takes ranked entries until the cumulative percentage first reaches or exceeds
     * {@code targetPercentage}, including that entry.
     *
     * <p>A target of 0 or less yields an empty report. A target above 100 can never be reached
     * and yields the whole ranking.</p>
     */
    public static CoverageReport coverageToPercentage(final List<RankedEntry> ranked,
                                                      final long totalOccurrences,
                                                      final double targetPercentage) {
        final CoverageTarget target = CoverageTarget.percentage(targetPercentage);
        if (targetPercentage <= 0 || ranked.isEmpty() || totalOccurrences <= 0) {
            return CoverageReport.empty(target, Math.max(totalOccurrences, 0), ranked.size());
        }

        final List<CoveragePoint> points = new ArrayList<>();
        long cumulative = 0;
        for (final RankedEntry entry : ranked) {
            cumulative += entry.count();
            final double percentage = percentage(cumulative, totalOccurrences);
            points.add(new CoveragePoint(entry.rank(), entry.key(), entry.count(), percentage));
            if (percentage >= targetPercentage) {
                break;
            }
        }
        return new CoverageReport(target, points, totalOccurrences, ranked.size());
    }

    /**
     * Takes exactly {@code min(targetCount, ranked.size())} entries, whatever percentage they reach.
     * The points form the coverage curve up to {@code targetCount}.
     */
    public static CoverageReport coverageToCount(final List<RankedEntry> ranked,
                                                 final long totalOccurrences,
                                                 final int targetCount) {
        final CoverageTarget target = CoverageTarget.itemCount(targetCount);
        if (targetCount <= 0 || ranked.isEmpty() || totalOccurrences <= 0) {
            return CoverageReport.empty(target, Math.max(totalOccurrences, 0), ranked.size());
        }

        final int limit = Math.min(targetCount, ranked.size());
        final List<CoveragePoint> points = new ArrayList<>(limit);
        long cumulative = 0;
        for (int i = 0; i < limit; i++) {
            final RankedEntry entry = ranked.get(i);
            cumulative += entry.count();
            points.add(new CoveragePoint(entry.rank(), entry.key(), entry.count(),
                    percentage(cumulative, totalOccurrences)));
        }
        return new CoverageReport(target, points, totalOccurrences, ranked.size());
    }

    private static double percentage(final long cumulative, final long total) {
        return (cumulative * 100.0) / total;
    }
}
