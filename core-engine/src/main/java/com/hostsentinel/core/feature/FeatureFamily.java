package com.hostsentinel.core.feature;

import com.hostsentinel.core.model.MetricGroup;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detector family and the fixed, ordered fields that make up its vectors.
 *
 * <p>
 * Positions are part of the contract: models fitted on one vector are
 * scored against another, so the order below must never change.
 * </p>
 *
 * @since 1.0.0
 */
public enum FeatureFamily {

    SYSTEM(List.of(
            new Field(MetricGroup.CPU, "usage_percent"),
            new Field(MetricGroup.CPU, "load_avg_1m"),
            new Field(MetricGroup.CPU, "load_avg_5m"),
            new Field(MetricGroup.CPU, "context_switches"),
            new Field(MetricGroup.MEMORY, "usage_percent"),
            new Field(MetricGroup.MEMORY, "available_mb"),
            new Field(MetricGroup.MEMORY, "swap_usage_percent"),
            new Field(MetricGroup.DISK, "usage_percent"),
            new Field(MetricGroup.DISK, "read_bytes_per_sec"),
            new Field(MetricGroup.DISK, "write_bytes_per_sec"),
            new Field(MetricGroup.DISK, "io_wait_percent"))),

    NETWORK(List.of(
            new Field(MetricGroup.NETWORK, "latency_ms"),
            new Field(MetricGroup.NETWORK, "packet_loss_percent"),
            new Field(MetricGroup.NETWORK, "bandwidth_usage_percent"),
            new Field(MetricGroup.NETWORK, "connections_count"),
            new Field(MetricGroup.NETWORK, "bytes_sent_per_sec"),
            new Field(MetricGroup.NETWORK, "bytes_recv_per_sec")));

    /**
     * One vector position: a field inside a metric group.
     */
    public record Field(MetricGroup group, String name) {
    }

    private final List<Field> fields;
    private final Set<MetricGroup> groups;

    FeatureFamily(List<Field> fields) {
        this.fields = fields;
        Set<MetricGroup> g = EnumSet.noneOf(MetricGroup.class);
        fields.forEach(f -> g.add(f.group()));
        this.groups = g;
    }

    public List<Field> fields() {
        return fields;
    }

    /**
     * @return the metric groups this family reads from
     */
    public Set<MetricGroup> groups() {
        return EnumSet.copyOf(groups);
    }

    public int width() {
        return fields.size();
    }
}
