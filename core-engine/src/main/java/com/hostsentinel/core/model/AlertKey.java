package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity of an {@link Alert}: one finding type reported by one source.
 *
 * <p>
 * The string form is {@code type:source}, e.g.
 * {@code cpu_threshold_breach:web-01}. Source ids may themselves contain
 * colons; only the first one separates the two parts.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final char SEPARATOR = ':';

    private final FindingType type;
    private final String sourceId;

    private AlertKey(FindingType type, String sourceId) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
    }

    public static AlertKey of(FindingType type, String sourceId) {
        return new AlertKey(type, sourceId);
    }

    /**
     * Parse the {@code type:source} form.
     *
     * @param raw the string form of a key
     * @return the key, or empty if the string is malformed or names an
     *         unknown finding type
     */
    public static Optional<AlertKey> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int idx = raw.indexOf(SEPARATOR);
        if (idx <= 0 || idx == raw.length() - 1) {
            return Optional.empty();
        }
        String sourceId = raw.substring(idx + 1);
        return FindingType.fromWireName(raw.substring(0, idx))
                .map(type -> new AlertKey(type, sourceId));
    }

    public FindingType getType() {
        return type;
    }

    public String getSourceId() {
        return sourceId;
    }

    @JsonValue
    @Override
    public String toString() {
        return type.wireName() + SEPARATOR + sourceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertKey that))
            return false;
        return type == that.type && sourceId.equals(that.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sourceId);
    }
}
