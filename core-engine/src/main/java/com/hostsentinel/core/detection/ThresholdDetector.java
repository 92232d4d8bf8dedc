package com.hostsentinel.core.detection;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.config.DetectionConfig.ThresholdSettings;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.MetricGroup;
import com.hostsentinel.core.model.Severity;
import com.hostsentinel.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Static threshold detector.
 *
 * <p>
 * Compares the latest usage of each present group against a fixed limit
 * (strict {@code >}). cpu, memory and disk breaches are {@code high}, or
 * {@code critical} above the group's second limit; a latency breach is
 * always {@code medium}. Each breach is reported separately.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Stateless; the buffer is not read.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    static final String USAGE_FIELD = "usage_percent";
    static final String LATENCY_FIELD = "latency_ms";

    private final ThresholdSettings settings;

    public ThresholdDetector(ThresholdSettings settings) {
        this.settings = Objects.requireNonNull(settings, "ThresholdSettings must not be null");
    }

    @Override
    public List<Finding> detect(Snapshot snapshot, TelemetryBuffer buffer) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        List<Finding> findings = new ArrayList<>(4);

        checkUsage(snapshot, MetricGroup.CPU, "CPU", FindingType.CPU_THRESHOLD_BREACH,
                settings.getCpuWarning(), settings.getCpuCritical(), findings);
        checkUsage(snapshot, MetricGroup.MEMORY, "Memory", FindingType.MEMORY_THRESHOLD_BREACH,
                settings.getMemoryWarning(), settings.getMemoryCritical(), findings);
        checkUsage(snapshot, MetricGroup.DISK, "Disk", FindingType.DISK_THRESHOLD_BREACH,
                settings.getDiskWarning(), settings.getDiskCritical(), findings);

        if (snapshot.hasGroup(MetricGroup.NETWORK)) {
            double latency = snapshot.getValueOrZero(MetricGroup.NETWORK, LATENCY_FIELD);
            if (latency > settings.getLatencyWarningMs()) {
                LOG.debug("Latency breach on {}: {}ms > {}ms",
                        snapshot.getSourceId(), latency, settings.getLatencyWarningMs());
                findings.add(Finding.builder()
                        .type(FindingType.NETWORK_LATENCY_HIGH)
                        .severity(Severity.MEDIUM)
                        .value(latency)
                        .threshold(settings.getLatencyWarningMs())
                        .description(String.format(Locale.ROOT,
                                "Network latency %.1fms exceeds threshold", latency))
                        .build());
            }
        }
        return findings;
    }

    @Override
    public String getName() {
        return "threshold";
    }

    private static void checkUsage(Snapshot snapshot, MetricGroup group, String label, FindingType type,
            double warning, double critical, List<Finding> findings) {
        if (!snapshot.hasGroup(group)) {
            return;
        }
        double usage = snapshot.getValueOrZero(group, USAGE_FIELD);
        if (usage <= warning) {
            return;
        }
        Severity severity = usage > critical ? Severity.CRITICAL : Severity.HIGH;
        LOG.debug("{} breach on {}: {} > {} ({})",
                label, snapshot.getSourceId(), usage, warning, severity.wireName());
        findings.add(Finding.builder()
                .type(type)
                .severity(severity)
                .value(usage)
                .threshold(warning)
                .description(String.format(Locale.ROOT, "%s usage %.1f%% exceeds threshold", label, usage))
                .build());
    }
}
