package com.climatewatch.common.exception;

import com.climatewatch.common.model.Season;

public class NoBaselineException extends ClimateException {
    private final String city;
    private final Season season;

    public NoBaselineException(String component, String city, Season season) {
        super(component, ErrorKind.NO_BASELINE,
            "No seasonal baseline for city=" + city + " season=" + season.wireName());
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
