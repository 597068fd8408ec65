package com.climatewatch.analysis.service;

import com.climatewatch.common.model.ClimateAnalysis;

import java.time.Instant;

/**
 * The analysis snapshot currently served, with the time it was loaded.
 */
public record ActiveDataset(
    ClimateAnalysis analysis,
    Instant loadedAt
) {}
