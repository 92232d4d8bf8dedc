package com.hostsentinel.core.detection;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.config.DetectionConfig.TrendSettings;
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
 * Drift detector for monotonic cpu rises and memory leaks.
 *
 * <h3>CPU rule</h3>
 * <p>
 * Over the cpu-bearing snapshots among the last {@code cpuLookback} entries
 * (at least {@code cpuMinSamples} required), compares the mean of the most
 * recent {@code cpuWindow} usages with the mean of the window ending
 * {@code 2 * cpuWindow} samples back. A rise above {@code cpuRiseThreshold}
 * points is a {@code high} {@link FindingType#CPU_TREND_ANOMALY}.
 * </p>
 *
 * <h3>Memory rule</h3>
 * <p>
 * Fits a least-squares line over the last {@code memorySamples} memory
 * usages. A slope above {@code memorySlopeThreshold} points per sample is a
 * {@code high} {@link FindingType#MEMORY_LEAK_PATTERN}.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    private static final String USAGE_FIELD = "usage_percent";

    private final TrendSettings settings;

    public TrendDetector(TrendSettings settings) {
        this.settings = Objects.requireNonNull(settings, "TrendSettings must not be null");
    }

    @Override
    public List<Finding> detect(Snapshot snapshot, TelemetryBuffer buffer) {
        Objects.requireNonNull(buffer, "TelemetryBuffer must not be null");
        int lookback = Math.max(settings.getCpuLookback(), settings.getMemorySamples());
        List<Snapshot> recent = buffer.recent(lookback);

        List<Finding> findings = new ArrayList<>(2);
        detectCpuRise(snapshot, recent, findings);
        detectMemoryLeak(snapshot, recent, findings);
        return findings;
    }

    @Override
    public String getName() {
        return "trend";
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    private void detectCpuRise(Snapshot snapshot, List<Snapshot> recent, List<Finding> findings) {
        int from = Math.max(0, recent.size() - settings.getCpuLookback());
        List<Double> cpu = usages(recent.subList(from, recent.size()), MetricGroup.CPU);
        if (cpu.size() < settings.getCpuMinSamples()) {
            LOG.trace("CPU trend on {}: {} samples, need {}",
                    snapshot.getSourceId(), cpu.size(), settings.getCpuMinSamples());
            return;
        }

        int n = cpu.size();
        int w = settings.getCpuWindow();
        double recentAvg = LinearTrend.mean(cpu, n - w, n);
        double olderAvg = LinearTrend.mean(cpu, n - 3 * w, n - 2 * w);
        double rise = recentAvg - olderAvg;

        if (rise > settings.getCpuRiseThreshold()) {
            LOG.debug("CPU trend fired on {}: {} -> {}", snapshot.getSourceId(), olderAvg, recentAvg);
            findings.add(Finding.builder()
                    .type(FindingType.CPU_TREND_ANOMALY)
                    .severity(Severity.HIGH)
                    .value(rise)
                    .description(String.format(Locale.ROOT,
                            "Rapid CPU increase detected: %.1f%% → %.1f%%", olderAvg, recentAvg))
                    .build());
        }
    }

    private void detectMemoryLeak(Snapshot snapshot, List<Snapshot> recent, List<Finding> findings) {
        List<Double> memory = usages(recent, MetricGroup.MEMORY);
        int needed = settings.getMemorySamples();
        if (memory.size() < needed) {
            LOG.trace("Memory trend on {}: {} samples, need {}",
                    snapshot.getSourceId(), memory.size(), needed);
            return;
        }

        double slope = LinearTrend.slope(memory.subList(memory.size() - needed, memory.size()));
        if (slope > settings.getMemorySlopeThreshold()) {
            LOG.debug("Memory leak pattern on {}: slope {}", snapshot.getSourceId(), slope);
            findings.add(Finding.builder()
                    .type(FindingType.MEMORY_LEAK_PATTERN)
                    .severity(Severity.HIGH)
                    .value(slope)
                    .description(String.format(Locale.ROOT,
                            "Potential memory leak detected (trend: +%.1f%% per interval)", slope))
                    .build());
        }
    }

    private static List<Double> usages(List<Snapshot> snapshots, MetricGroup group) {
        List<Double> values = new ArrayList<>(snapshots.size());
        for (Snapshot s : snapshots) {
            if (s.hasGroup(group)) {
                values.add(s.getValueOrZero(group, USAGE_FIELD));
            }
        }
        return values;
    }
}
