package com.climatewatch.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record DatasetSummary(
    @JsonProperty("cities") List<String> cities,
    @JsonProperty("readings") int readings,
    @JsonProperty("window") int window,
    @JsonProperty("loadedAt") Instant loadedAt
) {}
