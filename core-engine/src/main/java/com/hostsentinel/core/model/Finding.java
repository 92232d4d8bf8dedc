package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Transient detection result produced by one detector for one snapshot.
 *
 * <p>
 * {@code value} holds the model score for outlier findings, the measured
 * metric for threshold findings and the measured delta or slope for trend
 * findings. {@code threshold} is set only when the detector compared against
 * a fixed limit.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code severity} and
 * {@code description} are required; {@code suggestedAction} defaults to the
 * type's own remediation tag.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Finding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FindingType type;
    private final Severity severity;
    private final double value;
    private final Double threshold;
    private final String description;
    private final String suggestedAction;

    private Finding(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.description = Objects.requireNonNull(builder.description, "description must not be null");
        this.value = builder.value;
        this.threshold = builder.threshold;
        this.suggestedAction = builder.suggestedAction != null
                ? builder.suggestedAction
                : type.suggestedAction();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Finding} instances.
     */
    public static class Builder {
        private FindingType type;
        private Severity severity;
        private double value;
        private Double threshold;
        private String description;
        private String suggestedAction;

        public Builder type(FindingType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder suggestedAction(String suggestedAction) {
            this.suggestedAction = suggestedAction;
            return this;
        }

        /**
         * @throws NullPointerException if type, severity or description is missing
         */
        public Finding build() {
            return new Finding(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("type")
    public FindingType getType() {
        return type;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("score_or_value")
    public double getValue() {
        return value;
    }

    /**
     * @return the limit the value was compared against, if any
     */
    public OptionalDouble getThreshold() {
        return threshold == null ? OptionalDouble.empty() : OptionalDouble.of(threshold);
    }

    @JsonProperty("threshold")
    Double thresholdOrNull() {
        return threshold;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("suggested_action")
    public String getSuggestedAction() {
        return suggestedAction;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Finding that))
            return false;
        return type == that.type
                && severity == that.severity
                && Double.compare(value, that.value) == 0
                && Objects.equals(threshold, that.threshold)
                && description.equals(that.description)
                && suggestedAction.equals(that.suggestedAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, value, threshold, description, suggestedAction);
    }

    @Override
    public String toString() {
        return "Finding{" +
                "type=" + type.wireName() +
                ", severity=" + severity.wireName() +
                ", value=" + value +
                ", threshold=" + threshold +
                ", description='" + description + '\'' +
                '}';
    }
}
