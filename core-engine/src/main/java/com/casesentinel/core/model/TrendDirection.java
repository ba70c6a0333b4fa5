package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Direction of a trending topic relative to its baseline period.
 *
 * @since 1.0.0
 */
public enum TrendDirection {

    RISING,
    STABLE,
    DECLINING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TrendDirection fromWireName(String value) {
        Objects.requireNonNull(value, "Trend direction must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
