package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Impact level of a {@link Signal} or {@link Hypothesis}. Serialized as lowercase strings.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null) return null;
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
