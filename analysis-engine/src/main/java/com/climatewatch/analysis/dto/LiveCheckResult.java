package com.climatewatch.analysis.dto;

import com.climatewatch.common.model.LiveTemperature;
import com.climatewatch.common.model.LiveVerdict;
import com.fasterxml.jackson.annotation.JsonProperty;

public record LiveCheckResult(
    @JsonProperty("live") LiveTemperature live,
    @JsonProperty("verdict") LiveVerdict verdict
) {}
