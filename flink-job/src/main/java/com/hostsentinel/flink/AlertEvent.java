package com.hostsentinel.flink;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Outbound record published to the alerts topic.
 *
 * <p>
 * A {@code finding} event carries the finding and the alert state it
 * produced; a {@code resolved} event carries only the resolved alert.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AlertEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Kind of event. */
    public enum Type {
        FINDING,
        RESOLVED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Type type;
    private final String sourceId;
    private final Finding finding;
    private final Alert alert;
    private final Instant timestamp;

    private AlertEvent(Type type, String sourceId, Finding finding, Alert alert, Instant timestamp) {
        this.type = type;
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.finding = finding;
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static AlertEvent finding(Finding finding, Alert alert) {
        Objects.requireNonNull(finding, "finding must not be null");
        return new AlertEvent(Type.FINDING, alert.getSourceId(), finding, alert, alert.getLastSeen());
    }

    public static AlertEvent resolved(Alert alert) {
        Instant resolvedAt = alert.getResolvedAt()
                .orElseThrow(() -> new IllegalArgumentException("Alert " + alert.getKey() + " is not resolved"));
        return new AlertEvent(Type.RESOLVED, alert.getSourceId(), null, alert, resolvedAt);
    }

    @JsonProperty("event")
    public Type getType() {
        return type;
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    public Optional<Finding> getFinding() {
        return Optional.ofNullable(finding);
    }

    @JsonProperty("finding")
    Finding findingOrNull() {
        return finding;
    }

    @JsonProperty("alert")
    public Alert getAlert() {
        return alert;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AlertEvent{" +
                "type=" + type.wireName() +
                ", sourceId='" + sourceId + '\'' +
                ", alert=" + alert +
                '}';
    }
}
