package com.hostsentinel.core.engine;

import com.hostsentinel.core.model.MetricGroup;

import java.util.Objects;
import java.util.Optional;

/**
 * One problem found by the health gauge.
 *
 * @param component the metric group at fault
 * @param issue     short description, e.g. {@code "Critical CPU usage"}
 * @param value     the measured usage
 * @param impact    expected consequence; set for critical issues only
 * @since 1.0.0
 */
public record HealthIssue(MetricGroup component, String issue, double value, String impact) {

    public HealthIssue {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(issue, "issue must not be null");
    }

    public Optional<String> impactIfAny() {
        return Optional.ofNullable(impact);
    }
}
