package de.mirkosertic.vocabcoverage.coverage;

import java.util.List;

/**
 * Result of a coverage walk over a ranking.
 *
 * <p>{@code points} are ordered by rank and their cumulative percentages never decrease.
 * An empty report has no points and a coverage of 0.</p>
 *
 * @param target           the target the walk was run with
 * @param points           the ranked keys up to the stopping point
 * @param totalOccurrences sum of all counts in the analysed table
 * @param distinctKeys     number of keys in the analysed table
 */
public record CoverageReport(
        CoverageTarget target,
        List<CoveragePoint> points,
        long totalOccurrences,
        int distinctKeys
) {

    public CoverageReport {
        points = List.copyOf(points);
    }

    public static CoverageReport empty(final CoverageTarget target, final long totalOccurrences, final int distinctKeys) {
        return new CoverageReport(target, List.of(), totalOccurrences, distinctKeys);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    /**
     * @return the cumulative percentage of the last point, or 0 for an empty report
     */
    public double coverageReached() {
        return points.isEmpty() ? 0.0 : points.get(points.size() - 1).cumulativePercentage();
    }

    public List<String> keys() {
        return points.stream().map(CoveragePoint::key).toList();
    }

    /**
     * Cumulative percentage per rank position, index 0 being rank 1.
     */
    public List<Double> curve() {
        return points.stream().map(CoveragePoint::cumulativePercentage).toList();
    }
}
