package com.hostsentinel.core.engine;

import com.hostsentinel.core.model.MetricGroup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Short-horizon cpu and memory trends over the last few snapshots of one
 * history, with plain-text insights and an efficiency score.
 *
 * @since 1.0.0
 */
public final class PerformanceInsights {

    private static final PerformanceInsights EMPTY =
            new PerformanceInsights(Map.of(), List.of(), List.of(), null);

    /** Direction of a {@link ResourceTrend}. */
    public enum Direction {
        INCREASING,
        DECREASING,
        STABLE
    }

    /**
     * @param direction increasing or decreasing beyond the stability band,
     *                  else stable
     * @param change    mean of the newest samples minus mean of the oldest
     * @param average   mean over the whole window
     */
    public record ResourceTrend(Direction direction, double change, double average) {
    }

    private final Map<MetricGroup, ResourceTrend> trends;
    private final List<String> insights;
    private final List<String> recommendations;
    private final Integer efficiencyScore;

    PerformanceInsights(Map<MetricGroup, ResourceTrend> trends, List<String> insights,
            List<String> recommendations, Integer efficiencyScore) {
        this.trends = trends.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(trends));
        this.insights = List.copyOf(insights);
        this.recommendations = List.copyOf(recommendations);
        this.efficiencyScore = efficiencyScore;
    }

    /**
     * @return insights for a history too short to analyse
     */
    public static PerformanceInsights empty() {
        return EMPTY;
    }

    public Optional<ResourceTrend> trend(MetricGroup group) {
        return Optional.ofNullable(trends.get(group));
    }

    public Map<MetricGroup, ResourceTrend> getTrends() {
        return trends;
    }

    public List<String> getInsights() {
        return insights;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public OptionalInt getEfficiencyScore() {
        return efficiencyScore == null ? OptionalInt.empty() : OptionalInt.of(efficiencyScore);
    }

    @Override
    public String toString() {
        return "PerformanceInsights{" +
                "trends=" + trends +
                ", insights=" + insights +
                ", efficiencyScore=" + efficiencyScore +
                '}';
    }
}
