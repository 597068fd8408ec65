package com.climatewatch.common.stats;

import com.climatewatch.common.exception.InsufficientDataException;
import com.climatewatch.common.model.CitySeries;
import com.climatewatch.common.model.SeriesSummary;

import java.util.Arrays;

/**
 * Descriptive statistics of a city's temperature history: count, mean,
 * sample std, min, quartiles and max.
 */
public final class SeriesSummarizer {

    private SeriesSummarizer() {}

    /**
     * @throws InsufficientDataException when the series is empty
     */
    public static SeriesSummary summarize(CitySeries series) {
        double[] values = series.temperatures();
        if (values.length == 0) {
            throw new InsufficientDataException("SeriesSummarizer",
                "Cannot summarize an empty series for city=" + series.city(), 1, 0);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        return new SeriesSummary(
            series.city(),
            values.length,
            Statistics.mean(values),
            Statistics.orNull(Statistics.sampleStd(values)),
            sorted[0],
            Statistics.percentileOfSorted(sorted, 0.25),
            Statistics.percentileOfSorted(sorted, 0.50),
            Statistics.percentileOfSorted(sorted, 0.75),
            sorted[sorted.length - 1]
        );
    }
}
