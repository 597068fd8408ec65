package com.climatewatch.common.exception;

import com.climatewatch.common.model.Season;

/**
 * The (city, season) baseline was built from a single observation, so its
 * standard deviation is undefined and the 2-sigma rule cannot be applied.
 */
public class InconclusiveBaselineException extends ClimateException {
    private final String city;
    private final Season season;

    public InconclusiveBaselineException(String component, String city, Season season, int sampleCount) {
        super(component, ErrorKind.INCONCLUSIVE_BASELINE,
            "Baseline for city=" + city + " season=" + season.wireName()
                + " has an undefined standard deviation (samples=" + sampleCount + ")");
        this.city = city;
        this.season = season;
    }

    public String getCity() {
        return city;
    }

    public Season getSeason() {
        return season;
    }
}
