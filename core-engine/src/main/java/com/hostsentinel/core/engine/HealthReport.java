package com.hostsentinel.core.engine;

import com.hostsentinel.core.model.MetricGroup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of the synchronous health gauge over the latest snapshot of one
 * history.
 *
 * <p>
 * {@code overallScore} starts at 100 and loses a fixed penalty per issue;
 * each present component scores {@code max(0, 100 - usage)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthReport {

    private static final HealthReport INSUFFICIENT_DATA = new HealthReport(
            HealthStatus.INSUFFICIENT_DATA, List.of(), List.of(), 0, Map.of());

    private final HealthStatus status;
    private final List<HealthIssue> criticalIssues;
    private final List<HealthIssue> warnings;
    private final int overallScore;
    private final Map<MetricGroup, Double> componentScores;

    HealthReport(HealthStatus status, List<HealthIssue> criticalIssues, List<HealthIssue> warnings,
            int overallScore, Map<MetricGroup, Double> componentScores) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.criticalIssues = List.copyOf(criticalIssues);
        this.warnings = List.copyOf(warnings);
        this.overallScore = overallScore;
        this.componentScores = componentScores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(componentScores));
    }

    /**
     * @return the report for a history that holds no snapshot yet
     */
    public static HealthReport insufficientData() {
        return INSUFFICIENT_DATA;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public List<HealthIssue> getCriticalIssues() {
        return criticalIssues;
    }

    public List<HealthIssue> getWarnings() {
        return warnings;
    }

    public int getOverallScore() {
        return overallScore;
    }

    public Map<MetricGroup, Double> getComponentScores() {
        return componentScores;
    }

    @Override
    public String toString() {
        return "HealthReport{" +
                "status=" + status.wireName() +
                ", overallScore=" + overallScore +
                ", criticalIssues=" + criticalIssues.size() +
                ", warnings=" + warnings.size() +
                ", componentScores=" + componentScores +
                '}';
    }
}
