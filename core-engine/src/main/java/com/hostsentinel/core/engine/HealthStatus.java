package com.hostsentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall verdict of a {@link HealthReport}.
 *
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY,
    WARNING,
    CRITICAL,
    INSUFFICIENT_DATA;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
