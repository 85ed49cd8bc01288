package org.podtrace.normalize;

/**
 * Percentile with linear interpolation between the closest ranks.
 */
final class Percentiles {
    private Percentiles() {}

    /**
     * @param sorted     Ascending, non-empty values
     * @param percentile Percentile in [0, 100]
     */
    static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        var rank = Math.min(100.0, Math.max(0.0, percentile)) / 100.0 * (sorted.length - 1);
        var lower = (int) Math.floor(rank);
        var upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
