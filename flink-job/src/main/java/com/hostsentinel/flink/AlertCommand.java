package com.hostsentinel.flink;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hostsentinel.core.model.AlertKey;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator command read from the alert command topic, e.g.
 * {@code {"action": "resolve", "key": "cpu_threshold_breach:web-01"}}.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlertCommand implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Supported command actions. */
    public enum Action {
        RESOLVE
    }

    private final Action action;
    private final AlertKey key;

    public AlertCommand(Action action, AlertKey key) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    public static AlertCommand resolve(AlertKey key) {
        return new AlertCommand(Action.RESOLVE, key);
    }

    /**
     * @throws IllegalArgumentException if the action is unknown or the key is malformed
     */
    @JsonCreator
    static AlertCommand fromJson(@JsonProperty("action") String action, @JsonProperty("key") String key) {
        Action parsedAction = parseAction(action)
                .orElseThrow(() -> new IllegalArgumentException("Unknown alert command action: '" + action + "'"));
        AlertKey parsedKey = AlertKey.parse(key)
                .orElseThrow(() -> new IllegalArgumentException("Malformed alert key: '" + key + "'"));
        return new AlertCommand(parsedAction, parsedKey);
    }

    private static Optional<Action> parseAction(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (Action a : Action.values()) {
            if (a.name().equalsIgnoreCase(raw.trim())) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    public Action getAction() {
        return action;
    }

    public AlertKey getKey() {
        return key;
    }

    /**
     * @return the source the command is routed to
     */
    public String getSourceId() {
        return key.getSourceId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertCommand that))
            return false;
        return action == that.action && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, key);
    }

    @Override
    public String toString() {
        return "AlertCommand{" + action.name().toLowerCase(Locale.ROOT) + " " + key + '}';
    }
}
