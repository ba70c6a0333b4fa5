package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Logical detection window: a current period and the baseline period that
 * immediately precedes it, both expressed in whole hours.
 *
 * <table>
 * <caption>Built-in windows</caption>
 * <tr><th>Window</th><th>Current</th><th>Baseline</th><th>Label</th></tr>
 * <tr><td>{@code hourly}</td><td>4h</td><td>4h</td><td>vs previous 4 hours</td></tr>
 * <tr><td>{@code daily}</td><td>24h</td><td>24h</td><td>vs previous 24 hours</td></tr>
 * <tr><td>{@code weekly}</td><td>168h</td><td>168h</td><td>vs last week</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum TimeWindow {

    HOURLY(4, 4, "vs previous 4 hours"),
    DAILY(24, 24, "vs previous 24 hours"),
    WEEKLY(168, 168, "vs last week");

    private static final int HOURS_PER_DAY = 24;

    private final int currentHours;
    private final int baselineHours;
    private final String label;

    TimeWindow(int currentHours, int baselineHours, String label) {
        this.currentHours = currentHours;
        this.baselineHours = baselineHours;
        this.label = label;
    }

    public int getCurrentHours() {
        return currentHours;
    }

    public int getBaselineHours() {
        return baselineHours;
    }

    public Duration currentDuration() {
        return Duration.ofHours(currentHours);
    }

    public Duration baselineDuration() {
        return Duration.ofHours(baselineHours);
    }

    /**
     * @return display label such as {@code "vs previous 4 hours"}
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return current period in hours, e.g. {@code "24 hours"}
     */
    public String hoursDescription() {
        return currentHours + " hours";
    }

    /**
     * @return current period in the largest whole unit, e.g. {@code "4 hours"}
     *         or {@code "7 days"}
     */
    public String spanDescription() {
        return describe(currentHours);
    }

    /**
     * @return e.g. {@code "Last 7 days compared to previous 7 days"}
     */
    public String comparisonDescription() {
        return "Last " + describe(currentHours) + " compared to previous " + describe(baselineHours);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value {@code hourly}, {@code daily} or {@code weekly}
     * @return the matching window
     * @throws IllegalArgumentException if {@code value} names no window
     */
    @JsonCreator
    public static TimeWindow fromWireName(String value) {
        Objects.requireNonNull(value, "Time window must not be null");
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (TimeWindow window : values()) {
            if (window.name().equals(normalised)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown time window: '" + value
                + "'. Supported: hourly, daily, weekly");
    }

    private static String describe(int hours) {
        if (hours >= HOURS_PER_DAY && hours % HOURS_PER_DAY == 0) {
            int days = hours / HOURS_PER_DAY;
            return days + (days == 1 ? " day" : " days");
        }
        return hours + (hours == 1 ? " hour" : " hours");
    }
}
