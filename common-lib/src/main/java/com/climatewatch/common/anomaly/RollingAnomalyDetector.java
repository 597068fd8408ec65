package com.climatewatch.common.anomaly;

import com.climatewatch.common.exception.ValidationException;
import com.climatewatch.common.model.AnomalyStatus;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.Reading;
import com.climatewatch.common.model.RollingAnalysis;
import com.climatewatch.common.model.RollingStats;
import com.climatewatch.common.stats.Statistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags historical anomalies against a trailing moving window, per city.
 *
 * <h3>Rule</h3>
 * <p>At position {@code i} the window is observations {@code [i-window+1 .. i]}
 * of the same city (trailing, not centered). With average {@code μ} and sample
 * standard deviation {@code σ} of that window:
 * <pre>
 *   ANOMALY   if temperature &gt; μ + 2σ or temperature &lt; μ - 2σ
 *   NORMAL    otherwise
 *   UNDEFINED while fewer than {@code window} observations are available
 * </pre>
 *
 * <p>Positions with an incomplete window carry {@code null} statistics and
 * status {@link AnomalyStatus#UNDEFINED}; they are never reported as normal.
 */
public final class RollingAnomalyDetector {

    /** Default trailing window, in observations. */
    public static final int DEFAULT_WINDOW = 30;

    private final int window;

    public RollingAnomalyDetector() {
        this(DEFAULT_WINDOW);
    }

    /**
     * @param window trailing window size; at least 2 so the sample deviation is defined
     */
    public RollingAnomalyDetector(int window) {
        if (window < 2) {
            throw new ValidationException("RollingAnomalyDetector",
                "Rolling window must be at least 2 but was " + window);
        }
        this.window = window;
    }

    public int window() {
        return window;
    }

    public RollingAnalysis detect(CitySeries series) {
        List<Reading> readings = series.readings();
        double[] temperatures = series.temperatures();
        List<RollingStats> stats = new ArrayList<>(readings.size());

        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            if (i + 1 < window) {
                stats.add(RollingStats.undefined(reading));
                continue;
            }
            int from = i + 1 - window;
            double average = Statistics.mean(temperatures, from, i + 1);
            double std = Statistics.sampleStd(temperatures, from, i + 1);

            AnomalyStatus status = Statistics.outsideTwoSigma(reading.temperature(), average, std)
                ? AnomalyStatus.ANOMALY
                : AnomalyStatus.NORMAL;
            stats.add(new RollingStats(reading, average, std, status));
        }
        return new RollingAnalysis(series.city(), window, stats);
    }
}
