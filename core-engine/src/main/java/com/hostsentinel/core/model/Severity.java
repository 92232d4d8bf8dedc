package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a {@link Finding} and of the {@link Alert} it opens.
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
