package com.climatewatch.analysis.exception;

import com.climatewatch.common.exception.ClimateException;
import com.climatewatch.common.exception.ErrorKind;

public class UnknownCityException extends ClimateException {
    private final String city;

    public UnknownCityException(String city) {
        super("AnalysisService", ErrorKind.UNKNOWN_CITY, "City not present in the loaded dataset: " + city);
        this.city = city;
    }

    public String getCity() {
        return city;
    }
}
