package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Alert}.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    ACTIVE,
    RESOLVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
