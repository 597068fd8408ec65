package com.climatewatch.common.baseline;

import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.PreparedDataset;
import com.climatewatch.common.model.Reading;
import com.climatewatch.common.model.Season;
import com.climatewatch.common.model.SeasonBaseline;
import com.climatewatch.common.model.SeasonalBaselines;
import com.climatewatch.common.stats.Statistics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates mean and sample standard deviation of temperature for every
 * (city, season) pair present in the history.
 *
 * <p>City names match case-sensitively. A group with a single observation gets
 * an undefined ({@code null}) standard deviation.
 */
public final class SeasonalBaselineCalculator {

    private SeasonalBaselineCalculator() {}

    public static SeasonalBaselines calculate(PreparedDataset dataset) {
        List<SeasonBaseline> rows = new ArrayList<>();
        for (CitySeries series : dataset.allSeries()) {
            rows.addAll(calculate(series));
        }
        return new SeasonalBaselines(rows);
    }

    /** Baselines of one city, ordered winter → autumn; seasons without readings are omitted. */
    public static List<SeasonBaseline> calculate(CitySeries series) {
        Map<Season, List<Double>> bySeason = new EnumMap<>(Season.class);
        for (Reading reading : series.readings()) {
            bySeason.computeIfAbsent(reading.season(), s -> new ArrayList<>()).add(reading.temperature());
        }

        List<SeasonBaseline> rows = new ArrayList<>(bySeason.size());
        bySeason.forEach((season, temperatures) -> {
            double[] values = temperatures.stream().mapToDouble(Double::doubleValue).toArray();
            rows.add(new SeasonBaseline(
                series.city(),
                season,
                values.length,
                Statistics.mean(values),
                Statistics.orNull(Statistics.sampleStd(values))));
        });
        return rows;
    }
}
