package com.climatewatch.common.model;

import com.climatewatch.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed calendar season, Northern-hemisphere convention.
 *
 * <p>Declaration order is the order seasonal profiles are presented in:
 * winter, spring, summer, autumn.
 *
 * <pre>
 *   12, 1, 2  → WINTER
 *   3, 4, 5   → SPRING
 *   6, 7, 8   → SUMMER
 *   9, 10, 11 → AUTUMN
 * </pre>
 */
public enum Season {

    WINTER("winter"),
    SPRING("spring"),
    SUMMER("summer"),
    AUTUMN("autumn");

    private final String wireName;

    Season(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Maps a calendar month to its season.
     *
     * @param month 1 (January) to 12 (December)
     * @throws ValidationException when the month is outside 1..12
     */
    public static Season fromMonth(int month) {
        switch (month) {
            case 12: case 1: case 2:  return WINTER;
            case 3: case 4: case 5:   return SPRING;
            case 6: case 7: case 8:   return SUMMER;
            case 9: case 10: case 11: return AUTUMN;
            default:
                throw new ValidationException("Season", "Month must be within 1..12 but was " + month);
        }
    }

    /**
     * Resolves a season from its wire name, ignoring case and surrounding blanks.
     *
     * @return the season, or {@code null} when the name is blank or unknown
     */
    @JsonCreator
    public static Season fromWireName(String name) {
        if (name == null || name.isBlank()) return null;
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Season season : values()) {
            if (season.wireName.equals(normalized)) return season;
        }
        return null;
    }
}
