package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * The four kinds of alert the engine can raise. Each type is produced by
 * exactly one detector.
 *
 * @since 1.0.0
 */
public enum AlertType {

    /** Volume increase of a business unit / category pair versus its baseline. */
    SPIKE,

    /** Absolute volume limit exceeded by a business unit. */
    THRESHOLD,

    /** High-severity cases containing risk keywords. */
    URGENCY,

    /** Low-severity cases whose text suggests a higher severity. */
    MISCLASSIFICATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value wire name such as {@code "spike"}
     * @return the matching type
     * @throws IllegalArgumentException if {@code value} names no alert type
     */
    @JsonCreator
    public static AlertType fromWireName(String value) {
        Objects.requireNonNull(value, "Alert type must not be null");
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (AlertType type : values()) {
            if (type.name().equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: '" + value
                + "'. Supported: spike, threshold, urgency, misclassification");
    }
}
