package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Severity shared by cases and alerts, ordered from {@link #LOW} to
 * {@link #CRITICAL}.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Orders the most severe value first. */
    public static final Comparator<Severity> MOST_SEVERE_FIRST = Comparator.comparingInt(Severity::ordinal)
            .reversed();

    /**
     * @return lowercase name used in storage and JSON
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire name, ignoring case and surrounding whitespace.
     *
     * @param value wire name such as {@code "high"}
     * @return the matching severity
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if {@code value} names no severity
     */
    @JsonCreator
    public static Severity fromWireName(String value) {
        Objects.requireNonNull(value, "Severity must not be null");
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalised)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value
                + "'. Supported: low, medium, high, critical");
    }
}
