package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Operator-driven lifecycle of a persisted alert. The engine only ever writes
 * {@link #ACTIVE}; later transitions happen outside it.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    DISMISSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromWireName(String value) {
        Objects.requireNonNull(value, "Alert status must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
