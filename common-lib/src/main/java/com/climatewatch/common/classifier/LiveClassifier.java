package com.climatewatch.common.classifier;

import com.climatewatch.common.exception.InconclusiveBaselineException;
import com.climatewatch.common.exception.NoBaselineException;
import com.climatewatch.common.model.LiveObservation;
import com.climatewatch.common.model.LiveVerdict;
import com.climatewatch.common.model.Season;
import com.climatewatch.common.model.SeasonBaseline;
import com.climatewatch.common.model.SeasonalBaselines;
import com.climatewatch.common.stats.Statistics;

/**
 * Pure stateless classifier that judges one live temperature against the
 * seasonal baseline of its city.
 *
 * <p>Resolution steps:
 * <ol>
 *   <li>month → season (12,1,2 winter; 3,4,5 spring; 6,7,8 summer; 9,10,11 autumn)</li>
 *   <li>lookup of the (city, season) baseline, else {@link NoBaselineException}</li>
 *   <li>undefined baseline deviation → {@link InconclusiveBaselineException}</li>
 *   <li>anomalous iff temperature &gt; mean + 2·std or &lt; mean - 2·std</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class LiveClassifier {

    private static final String COMPONENT = "LiveClassifier";

    private LiveClassifier() {}

    public static LiveVerdict classify(SeasonalBaselines baselines, LiveObservation observation) {
        Season season = Season.fromMonth(observation.month());

        SeasonBaseline baseline = baselines.find(observation.city(), season);
        if (baseline == null) {
            throw new NoBaselineException(COMPONENT, observation.city(), season);
        }
        return classify(baseline, observation.temperature());
    }

    /**
     * Applies the 2-sigma rule against an already resolved baseline.
     */
    public static LiveVerdict classify(SeasonBaseline baseline, double temperature) {
        if (!baseline.hasDefinedStd()) {
            throw new InconclusiveBaselineException(COMPONENT,
                baseline.city(), baseline.season(), baseline.sampleCount());
        }

        double mean = baseline.meanTemperature();
        double std = baseline.stdTemperature();
        boolean anomalous = Statistics.outsideTwoSigma(temperature, mean, std);

        // reported as read, unrounded
        String message = anomalous
            ? "Temperature " + temperature + "°C is anomalous"
            : "Temperature " + temperature + "°C is within the normal range";

        return new LiveVerdict(baseline.city(), baseline.season(), temperature, mean, std,
            baseline.lowerBand(), baseline.upperBand(), anomalous, message);
    }
}
