package com.casesentinel.core.config;

import com.casesentinel.core.model.TimeWindow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Absolute case-count limits per {@link TimeWindow}. A table may leave a
 * window unset; callers decide what a missing value means.
 *
 * @since 1.0.0
 */
public final class ThresholdTable {

    private final Map<TimeWindow, Integer> limits;

    private ThresholdTable(Map<TimeWindow, Integer> limits) {
        EnumMap<TimeWindow, Integer> copy = new EnumMap<>(TimeWindow.class);
        for (Map.Entry<TimeWindow, Integer> entry : limits.entrySet()) {
            TimeWindow window = Objects.requireNonNull(entry.getKey(), "window must not be null");
            Integer limit = entry.getValue();
            if (limit == null || limit <= 0) {
                throw new ConfigurationException(
                        "Threshold for window '" + window.wireName() + "' must be > 0, got: " + limit);
            }
            copy.put(window, limit);
        }
        this.limits = Collections.unmodifiableMap(copy);
    }

    /**
     * @return a table with a limit for every built-in window
     * @throws ConfigurationException if any limit is not positive
     */
    public static ThresholdTable of(int hourly, int daily, int weekly) {
        Map<TimeWindow, Integer> limits = new EnumMap<>(TimeWindow.class);
        limits.put(TimeWindow.HOURLY, hourly);
        limits.put(TimeWindow.DAILY, daily);
        limits.put(TimeWindow.WEEKLY, weekly);
        return new ThresholdTable(limits);
    }

    /**
     * @param limits window to limit; windows absent from the map stay unset
     * @throws ConfigurationException if any limit is not positive
     */
    public static ThresholdTable of(Map<TimeWindow, Integer> limits) {
        Objects.requireNonNull(limits, "limits must not be null");
        return new ThresholdTable(limits);
    }

    /**
     * @return the limit for {@code window}, or empty when the table leaves it
     *         unset
     */
    public OptionalInt valueFor(TimeWindow window) {
        Integer limit = limits.get(window);
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public Map<TimeWindow, Integer> asMap() {
        return limits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdTable that))
            return false;
        return limits.equals(that.limits);
    }

    @Override
    public int hashCode() {
        return limits.hashCode();
    }

    @Override
    public String toString() {
        return "ThresholdTable" + limits;
    }
}
