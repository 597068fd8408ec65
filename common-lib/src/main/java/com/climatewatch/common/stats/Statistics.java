package com.climatewatch.common.stats;

/**
 * Pure calculation helpers shared by the detectors and aggregators.
 * Inputs are in chronological order (index 0 = oldest observation).
 */
public final class Statistics {

    private Statistics() {}

    // ── Mean ────────────────────────────────────────────────────────────────

    /**
     * @return arithmetic mean of {@code values[from, to)}, or NaN for an empty range
     */
    public static double mean(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) return Double.NaN;
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / n;
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    // ── Sample standard deviation (n - 1) ───────────────────────────────────

    /**
     * Two-pass sample standard deviation of {@code values[from, to)}.
     *
     * @return the deviation, or NaN when the range holds fewer than two values
     */
    public static double sampleStd(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) return Double.NaN;
        double mean = mean(values, from, to);
        double squares = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / (n - 1));
    }

    public static double sampleStd(double[] values) {
        return sampleStd(values, 0, values.length);
    }

    // ── Percentile ──────────────────────────────────────────────────────────

    /**
     * Percentile of an ascending, non-empty array with linear interpolation
     * between closest ranks ({@code rank = p * (n - 1)}).
     *
     * @param p fraction in [0, 1]
     */
    static double percentileOfSorted(double[] sorted, double p) {
        double rank = p * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }

    // ── 2-sigma rule ────────────────────────────────────────────────────────

    /** Multiplier of the standard deviation beyond which a value is anomalous. */
    public static final double SIGMA_MULTIPLIER = 2.0;

    /**
     * {@code value > mean + 2·std OR value < mean - 2·std}. With {@code std == 0}
     * this degenerates to {@code value != mean}.
     */
    public static boolean outsideTwoSigma(double value, double mean, double std) {
        return value > mean + SIGMA_MULTIPLIER * std
            || value < mean - SIGMA_MULTIPLIER * std;
    }

    /** Boxes a statistic, mapping NaN to {@code null}. */
    public static Double orNull(double value) {
        return Double.isNaN(value) ? null : value;
    }
}
