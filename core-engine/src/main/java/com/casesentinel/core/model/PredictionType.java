package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Pattern that produced a {@link PredictedRisk}.
 *
 * @since 1.0.0
 */
public enum PredictionType {

    /** Daily counts rose several days in a row. */
    CONSECUTIVE_INCREASE,

    /** Current count is close to the alert threshold. */
    APPROACHING_THRESHOLD,

    /** Day-over-day growth is speeding up. */
    ACCELERATING_GROWTH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PredictionType fromWireName(String value) {
        Objects.requireNonNull(value, "Prediction type must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
