package com.climatewatch.common.model;

/**
 * A freshly observed temperature handed to the classifier once the fetch has resolved.
 *
 * @param month calendar month of the observation, 1..12
 */
public record LiveObservation(String city, double temperature, int month) {

    public static LiveObservation of(String city, double temperature, int month) {
        return new LiveObservation(city, temperature, month);
    }
}
