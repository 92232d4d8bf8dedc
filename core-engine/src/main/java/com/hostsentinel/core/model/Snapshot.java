package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One telemetry sample reported by one monitored source.
 *
 * <p>
 * A snapshot carries zero or more nested numeric groups ({@code cpu},
 * {@code memory}, {@code disk}, {@code network}), each a mapping of field
 * name to value. Values that are not numeric are dropped when the snapshot
 * is built; string-encoded numbers are parsed. Agents routinely ship
 * diagnostic strings (an {@code error} entry, interface lists) next to the
 * numbers, and none of them are useful to the detectors.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Instances are immutable once built, so the telemetry buffer can hold a
 * plain reference and detectors can read it from any thread.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Snapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceId;
    private final Instant timestamp;
    private final Map<MetricGroup, Map<String, Double>> groups;

    private Snapshot(Builder builder) {
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        Map<MetricGroup, Map<String, Double>> copy = new EnumMap<>(MetricGroup.class);
        builder.groups.forEach((group, fields) ->
                copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.groups = Collections.unmodifiableMap(copy);
    }

    // ---------------------------------------------------------------
    // JSON factory
    // ---------------------------------------------------------------

    /**
     * Build a snapshot from its decoded JSON shape.
     *
     * <p>
     * {@code timestamp} may be an ISO-8601 instant, an ISO local date-time
     * (interpreted as UTC) or epoch milliseconds. A missing or unparseable
     * timestamp is replaced with the current time.
     * </p>
     */
    @JsonCreator
    public static Snapshot fromJson(
            @JsonProperty("source_id") @JsonAlias({"agent_id", "sourceId"}) String sourceId,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("cpu") Map<String, Object> cpu,
            @JsonProperty("memory") Map<String, Object> memory,
            @JsonProperty("disk") Map<String, Object> disk,
            @JsonProperty("network") Map<String, Object> network) {
        Builder builder = builder()
                .sourceId(sourceId)
                .timestamp(parseTimestamp(timestamp).orElseGet(Instant::now));
        putRaw(builder, MetricGroup.CPU, cpu);
        putRaw(builder, MetricGroup.MEMORY, memory);
        putRaw(builder, MetricGroup.DISK, disk);
        putRaw(builder, MetricGroup.NETWORK, network);
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @param group the metric group
     * @return {@code true} if the snapshot carries that group, even an empty one
     */
    public boolean hasGroup(MetricGroup group) {
        return groups.containsKey(group);
    }

    /**
     * @param group the metric group
     * @return unmodifiable field map, or empty if the group is absent
     */
    public Optional<Map<String, Double>> getGroup(MetricGroup group) {
        return Optional.ofNullable(groups.get(group));
    }

    /**
     * Look up one numeric field.
     *
     * @return the value, or empty if the group or the field is absent
     */
    public OptionalDouble getValue(MetricGroup group, String field) {
        Map<String, Double> fields = groups.get(group);
        if (fields == null) {
            return OptionalDouble.empty();
        }
        Double value = fields.get(field);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Look up one numeric field, defaulting to 0 when the field is missing.
     * Callers must check {@link #hasGroup(MetricGroup)} first when absence of
     * the whole group matters.
     */
    public double getValueOrZero(MetricGroup group, String field) {
        return getValue(group, field).orElse(0.0);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Snapshot}. {@code sourceId} and
     * {@code timestamp} are required.
     */
    public static class Builder {
        private String sourceId;
        private Instant timestamp;
        private final Map<MetricGroup, Map<String, Double>> groups = new EnumMap<>(MetricGroup.class);

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Declare a group as present, even if no field is ever added to it.
         */
        public Builder group(MetricGroup group) {
            groups.computeIfAbsent(group, g -> new LinkedHashMap<>());
            return this;
        }

        public Builder value(MetricGroup group, String field, double value) {
            Objects.requireNonNull(field, "field must not be null");
            groups.computeIfAbsent(group, g -> new LinkedHashMap<>()).put(field, value);
            return this;
        }

        public Builder cpu(String field, double value) {
            return value(MetricGroup.CPU, field, value);
        }

        public Builder memory(String field, double value) {
            return value(MetricGroup.MEMORY, field, value);
        }

        public Builder disk(String field, double value) {
            return value(MetricGroup.DISK, field, value);
        }

        public Builder network(String field, double value) {
            return value(MetricGroup.NETWORK, field, value);
        }

        public Snapshot build() {
            return new Snapshot(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void putRaw(Builder builder, MetricGroup group, Map<String, Object> raw) {
        if (raw == null) {
            return;
        }
        builder.group(group);
        raw.forEach((field, value) -> {
            if (field != null) {
                toDouble(value).ifPresent(v -> builder.value(group, field, v));
            }
        });
    }

    /** Numbers and numeric strings; NaN and infinities are dropped. */
    private static OptionalDouble toDouble(Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    static Optional<Instant> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
            } catch (NumberFormatException | DateTimeException outOfRange) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException notAnInstant) {
            try {
                return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Snapshot that))
            return false;
        return sourceId.equals(that.sourceId)
                && timestamp.equals(that.timestamp)
                && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, timestamp, groups);
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "sourceId='" + sourceId + '\'' +
                ", timestamp=" + timestamp +
                ", groups=" + groups +
                '}';
    }
}
