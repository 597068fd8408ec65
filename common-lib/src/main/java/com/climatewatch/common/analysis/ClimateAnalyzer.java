package com.climatewatch.common.analysis;

import com.climatewatch.common.anomaly.RollingAnomalyDetector;
import com.climatewatch.common.baseline.SeasonalBaselineCalculator;
import com.climatewatch.common.exception.InsufficientDataException;
import com.climatewatch.common.model.CityAnalysis;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.ClimateAnalysis;
import com.climatewatch.common.model.PreparedDataset;
import com.climatewatch.common.model.RawReading;
import com.climatewatch.common.model.SeasonalBaselines;
import com.climatewatch.common.model.Trend;
import com.climatewatch.common.series.SeriesPreparer;
import com.climatewatch.common.stats.SeriesSummarizer;
import com.climatewatch.common.trend.TrendEstimator;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one full analysis pass over a dataset snapshot.
 *
 * <p>Raw rows → {@link SeriesPreparer} → per city: rolling anomalies,
 * seasonal baselines, trend and summary. The branches are independent; a city
 * too short for a trend gets its trend marked unavailable and the pass goes on.
 * Nothing is cached between passes.
 */
public final class ClimateAnalyzer {

    private final RollingAnomalyDetector detector;

    public ClimateAnalyzer(int window) {
        this.detector = new RollingAnomalyDetector(window);
    }

    public ClimateAnalysis analyze(Collection<RawReading> rows) {
        return analyze(SeriesPreparer.prepare(rows));
    }

    public ClimateAnalysis analyze(PreparedDataset dataset) {
        SeasonalBaselines baselines = SeasonalBaselineCalculator.calculate(dataset);

        Map<String, CityAnalysis> cities = new LinkedHashMap<>();
        for (CitySeries series : dataset.allSeries()) {
            Trend trend = null;
            String unavailable = null;
            try {
                trend = TrendEstimator.estimate(series);
            } catch (InsufficientDataException e) {
                unavailable = e.getMessage();
            }

            cities.put(series.city(), new CityAnalysis(
                series.city(),
                series,
                detector.detect(series),
                baselines.forCity(series.city()),
                trend,
                unavailable,
                SeriesSummarizer.summarize(series)));
        }
        return new ClimateAnalysis(detector.window(), dataset.readingCount(), cities, baselines);
    }
}
