package com.climatewatch.common.trend;

import com.climatewatch.common.exception.InsufficientDataException;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.Trend;
import com.climatewatch.common.model.TrendDirection;

/**
 * Ordinary least-squares trend of temperature per city.
 *
 * <p>The regressor is the zero-based index of each observation in the city's
 * chronological order, never a date-derived value, so the slope is measured
 * in degrees per observation. Slope &gt; 0 is a positive trend; slope ≤ 0 is
 * negative.
 */
public final class TrendEstimator {

    /** Minimum observations for a line fit. */
    public static final int MIN_OBSERVATIONS = 2;

    private TrendEstimator() {}

    /**
     * @throws InsufficientDataException when the series has fewer than two observations
     */
    public static Trend estimate(CitySeries series) {
        double[] y = series.temperatures();
        int n = y.length;
        if (n < MIN_OBSERVATIONS) {
            throw new InsufficientDataException("TrendEstimator",
                "Cannot fit a trend for city=" + series.city(), MIN_OBSERVATIONS, n);
        }

        // x = 0..n-1, so mean(x) = (n-1)/2
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;

        double sxy = 0, sxx = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            sxy += dx * (y[i] - meanY);
            sxx += dx * dx;
        }

        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        return new Trend(series.city(), slope, intercept, n, TrendDirection.fromSlope(slope));
    }
}
