package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Nested numeric groups a {@link Snapshot} may carry.
 *
 * @since 1.0.0
 */
public enum MetricGroup {

    CPU,
    MEMORY,
    DISK,
    NETWORK;

    /**
     * @return the JSON key of this group, e.g. {@code "cpu"}
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
