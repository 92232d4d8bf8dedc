package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Deduplicated, stateful aggregate of the findings that share one
 * {@link AlertKey}.
 *
 * <p>
 * Instances are immutable. State transitions return new instances and are
 * performed only by the alert manager, which owns the live set.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <ul>
 * <li>{@link #open(String, Finding, Instant)}: first finding, count 1</li>
 * <li>{@link #recordOccurrence(Instant)}: repeat finding while active; bumps
 * {@code lastSeen} and {@code count}, keeps severity and description</li>
 * <li>{@link #resolve(Instant)}: explicit resolution, stamps
 * {@code resolvedAt}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AlertKey key;
    private final Severity severity;
    private final String description;
    private final String suggestedAction;
    private final AlertStatus status;
    private final int count;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final Instant resolvedAt;

    private Alert(AlertKey key, Severity severity, String description, String suggestedAction,
            AlertStatus status, int count, Instant firstSeen, Instant lastSeen, Instant resolvedAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.suggestedAction = suggestedAction;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.count = count;
        this.firstSeen = Objects.requireNonNull(firstSeen, "firstSeen must not be null");
        this.lastSeen = Objects.requireNonNull(lastSeen, "lastSeen must not be null");
        this.resolvedAt = resolvedAt;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Open a new active alert from the first finding seen for its key.
     */
    public static Alert open(String sourceId, Finding finding, Instant now) {
        Objects.requireNonNull(finding, "finding must not be null");
        return new Alert(AlertKey.of(finding.getType(), sourceId),
                finding.getSeverity(),
                finding.getDescription(),
                finding.getSuggestedAction(),
                AlertStatus.ACTIVE, 1, now, now, null);
    }

    /**
     * @throws IllegalStateException if the alert is already resolved
     */
    public Alert recordOccurrence(Instant now) {
        if (status != AlertStatus.ACTIVE) {
            throw new IllegalStateException("Cannot record occurrence on resolved alert " + key);
        }
        return new Alert(key, severity, description, suggestedAction,
                status, count + 1, firstSeen, now, null);
    }

    /**
     * @throws IllegalStateException if the alert is already resolved
     */
    public Alert resolve(Instant now) {
        if (status != AlertStatus.ACTIVE) {
            throw new IllegalStateException("Alert " + key + " is already resolved");
        }
        return new Alert(key, severity, description, suggestedAction,
                AlertStatus.RESOLVED, count, firstSeen, lastSeen, now);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("key")
    public AlertKey getKey() {
        return key;
    }

    @JsonProperty("type")
    public FindingType getType() {
        return key.getType();
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return key.getSourceId();
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("suggested_action")
    public String getSuggestedAction() {
        return suggestedAction;
    }

    @JsonProperty("status")
    public AlertStatus getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    @JsonProperty("first_seen")
    public Instant getFirstSeen() {
        return firstSeen;
    }

    @JsonProperty("last_seen")
    public Instant getLastSeen() {
        return lastSeen;
    }

    @JsonIgnore
    public Optional<Instant> getResolvedAt() {
        return Optional.ofNullable(resolvedAt);
    }

    @JsonProperty("resolved_at")
    Instant resolvedAtOrNull() {
        return resolvedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert that))
            return false;
        return count == that.count
                && key.equals(that.key)
                && status == that.status
                && firstSeen.equals(that.firstSeen)
                && lastSeen.equals(that.lastSeen)
                && Objects.equals(resolvedAt, that.resolvedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, status, count, firstSeen, lastSeen, resolvedAt);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "key=" + key +
                ", severity=" + severity.wireName() +
                ", status=" + status.wireName() +
                ", count=" + count +
                ", firstSeen=" + firstSeen +
                ", lastSeen=" + lastSeen +
                ", resolvedAt=" + resolvedAt +
                '}';
    }
}
