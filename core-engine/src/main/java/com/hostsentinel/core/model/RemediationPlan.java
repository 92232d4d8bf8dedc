package com.hostsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Remediation steps suggested for one {@link FindingType}.
 *
 * @param actions  ordered action tags, most preferred first
 * @param scripts  names of remediation scripts an agent may run
 * @param priority how urgently the plan should be carried out
 * @since 1.0.0
 */
public record RemediationPlan(List<String> actions, List<String> scripts, Severity priority)
        implements Serializable {

    /** Fallback plan for finding types without a dedicated one. */
    public static final RemediationPlan MANUAL_INVESTIGATION =
            new RemediationPlan(List.of("manual_investigation"), List.of(), Severity.LOW);

    public RemediationPlan {
        actions = List.copyOf(Objects.requireNonNull(actions, "actions must not be null"));
        scripts = List.copyOf(Objects.requireNonNull(scripts, "scripts must not be null"));
        Objects.requireNonNull(priority, "priority must not be null");
    }
}
