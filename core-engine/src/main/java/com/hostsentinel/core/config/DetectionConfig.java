package com.hostsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Every section and every property has a default, so an empty document (or
 * {@code new DetectionConfig()}) yields the standard detector set. Expected
 * YAML structure:
 * </p>
 *
 * <pre>
 * history:
 *   capacity: 1000
 *   scope: PER_SOURCE
 * thresholds:
 *   cpuWarning: 80
 *   cpuCritical: 95
 * outlier:
 *   randomSeed: 42
 *   system:
 *     minHistory: 50
 *     trees: 100
 * alerts:
 *   retentionHours: 24
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private HistorySettings history = new HistorySettings();
    private ThresholdSettings thresholds = new ThresholdSettings();
    private TrendSettings trend = new TrendSettings();
    private OutlierConfig outlier = new OutlierConfig();
    private PredictionSettings prediction = new PredictionSettings();
    private AlertSettings alerts = new AlertSettings();

    /**
     * Validate every section.
     *
     * @throws IllegalStateException listing every invalid property
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        history.validate(errors);
        thresholds.validate(errors);
        trend.validate(errors);
        outlier.validate(errors);
        prediction.validate(errors);
        alerts.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public HistorySettings getHistory() {
        return history;
    }

    public void setHistory(HistorySettings history) {
        this.history = history != null ? history : new HistorySettings();
    }

    public ThresholdSettings getThresholds() {
        return thresholds;
    }

    public void setThresholds(ThresholdSettings thresholds) {
        this.thresholds = thresholds != null ? thresholds : new ThresholdSettings();
    }

    public TrendSettings getTrend() {
        return trend;
    }

    public void setTrend(TrendSettings trend) {
        this.trend = trend != null ? trend : new TrendSettings();
    }

    public OutlierConfig getOutlier() {
        return outlier;
    }

    public void setOutlier(OutlierConfig outlier) {
        this.outlier = outlier != null ? outlier : new OutlierConfig();
    }

    public PredictionSettings getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSettings prediction) {
        this.prediction = prediction != null ? prediction : new PredictionSettings();
    }

    public AlertSettings getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertSettings alerts) {
        this.alerts = alerts != null ? alerts : new AlertSettings();
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "history=" + history +
                ", thresholds=" + thresholds +
                ", trend=" + trend +
                ", outlier=" + outlier +
                ", prediction=" + prediction +
                ", alerts=" + alerts +
                '}';
    }

    // ===============================================================
    // Sections
    // ===============================================================

    /**
     * Whether snapshot history is kept per source or in one shared window.
     */
    public enum HistoryScope {
        PER_SOURCE,
        SHARED
    }

    /** {@code history} section. */
    public static class HistorySettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private int capacity = 1000;
        private HistoryScope scope = HistoryScope.PER_SOURCE;
        private long idleEvictionMinutes = 60;

        void validate(List<String> errors) {
            if (capacity <= 0) {
                errors.add("history.capacity must be > 0, got " + capacity);
            }
            if (idleEvictionMinutes <= 0) {
                errors.add("history.idleEvictionMinutes must be > 0, got " + idleEvictionMinutes);
            }
            if (scope == null) {
                errors.add("history.scope is required (PER_SOURCE or SHARED)");
            }
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public HistoryScope getScope() {
            return scope;
        }

        public void setScope(HistoryScope scope) {
            this.scope = scope;
        }

        public long getIdleEvictionMinutes() {
            return idleEvictionMinutes;
        }

        public void setIdleEvictionMinutes(long idleEvictionMinutes) {
            this.idleEvictionMinutes = idleEvictionMinutes;
        }

        /** A history with no ingest for this long is dropped. */
        public Duration idleEviction() {
            return Duration.ofMinutes(idleEvictionMinutes);
        }

        @Override
        public String toString() {
            return "{capacity=" + capacity + ", scope=" + scope
                    + ", idleEvictionMinutes=" + idleEvictionMinutes + '}';
        }
    }

    /** {@code thresholds} section; limits are compared with a strict {@code >}. */
    public static class ThresholdSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private double cpuWarning = 80;
        private double cpuCritical = 95;
        private double memoryWarning = 85;
        private double memoryCritical = 95;
        private double diskWarning = 90;
        private double diskCritical = 98;
        private double latencyWarningMs = 200;

        void validate(List<String> errors) {
            checkPair(errors, "cpu", cpuWarning, cpuCritical);
            checkPair(errors, "memory", memoryWarning, memoryCritical);
            checkPair(errors, "disk", diskWarning, diskCritical);
            if (latencyWarningMs <= 0) {
                errors.add("thresholds.latencyWarningMs must be > 0, got " + latencyWarningMs);
            }
        }

        private static void checkPair(List<String> errors, String name, double warning, double critical) {
            if (warning <= 0) {
                errors.add("thresholds." + name + "Warning must be > 0, got " + warning);
            }
            if (critical < warning) {
                errors.add("thresholds." + name + "Critical (" + critical
                        + ") must be >= " + name + "Warning (" + warning + ")");
            }
        }

        public double getCpuWarning() {
            return cpuWarning;
        }

        public void setCpuWarning(double cpuWarning) {
            this.cpuWarning = cpuWarning;
        }

        public double getCpuCritical() {
            return cpuCritical;
        }

        public void setCpuCritical(double cpuCritical) {
            this.cpuCritical = cpuCritical;
        }

        public double getMemoryWarning() {
            return memoryWarning;
        }

        public void setMemoryWarning(double memoryWarning) {
            this.memoryWarning = memoryWarning;
        }

        public double getMemoryCritical() {
            return memoryCritical;
        }

        public void setMemoryCritical(double memoryCritical) {
            this.memoryCritical = memoryCritical;
        }

        public double getDiskWarning() {
            return diskWarning;
        }

        public void setDiskWarning(double diskWarning) {
            this.diskWarning = diskWarning;
        }

        public double getDiskCritical() {
            return diskCritical;
        }

        public void setDiskCritical(double diskCritical) {
            this.diskCritical = diskCritical;
        }

        public double getLatencyWarningMs() {
            return latencyWarningMs;
        }

        public void setLatencyWarningMs(double latencyWarningMs) {
            this.latencyWarningMs = latencyWarningMs;
        }

        @Override
        public String toString() {
            return "{cpu=" + cpuWarning + '/' + cpuCritical
                    + ", memory=" + memoryWarning + '/' + memoryCritical
                    + ", disk=" + diskWarning + '/' + diskCritical
                    + ", latencyMs=" + latencyWarningMs + '}';
        }
    }

    /** {@code trend} section. */
    public static class TrendSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        /** Minimum cpu-bearing snapshots before the rise rule runs. */
        private int cpuMinSamples = 15;

        /** How many recent cpu-bearing snapshots the rise rule looks at. */
        private int cpuLookback = 20;

        /** Size of the recent and the prior averaging window. */
        private int cpuWindow = 5;

        /** Rise in percentage points that counts as rapid. */
        private double cpuRiseThreshold = 30;

        private int memorySamples = 10;

        /** Slope in percentage points per sample that counts as a leak. */
        private double memorySlopeThreshold = 2.0;

        void validate(List<String> errors) {
            if (cpuWindow <= 0) {
                errors.add("trend.cpuWindow must be > 0, got " + cpuWindow);
            }
            if (cpuMinSamples < 3 * cpuWindow) {
                errors.add("trend.cpuMinSamples (" + cpuMinSamples
                        + ") must be >= 3 * cpuWindow (" + cpuWindow + ")");
            }
            if (cpuLookback < cpuMinSamples) {
                errors.add("trend.cpuLookback (" + cpuLookback
                        + ") must be >= cpuMinSamples (" + cpuMinSamples + ")");
            }
            if (memorySamples < 2) {
                errors.add("trend.memorySamples must be >= 2, got " + memorySamples);
            }
        }

        public int getCpuMinSamples() {
            return cpuMinSamples;
        }

        public void setCpuMinSamples(int cpuMinSamples) {
            this.cpuMinSamples = cpuMinSamples;
        }

        public int getCpuLookback() {
            return cpuLookback;
        }

        public void setCpuLookback(int cpuLookback) {
            this.cpuLookback = cpuLookback;
        }

        public int getCpuWindow() {
            return cpuWindow;
        }

        public void setCpuWindow(int cpuWindow) {
            this.cpuWindow = cpuWindow;
        }

        public double getCpuRiseThreshold() {
            return cpuRiseThreshold;
        }

        public void setCpuRiseThreshold(double cpuRiseThreshold) {
            this.cpuRiseThreshold = cpuRiseThreshold;
        }

        public int getMemorySamples() {
            return memorySamples;
        }

        public void setMemorySamples(int memorySamples) {
            this.memorySamples = memorySamples;
        }

        public double getMemorySlopeThreshold() {
            return memorySlopeThreshold;
        }

        public void setMemorySlopeThreshold(double memorySlopeThreshold) {
            this.memorySlopeThreshold = memorySlopeThreshold;
        }

        @Override
        public String toString() {
            return "{cpuMinSamples=" + cpuMinSamples + ", cpuLookback=" + cpuLookback
                    + ", cpuWindow=" + cpuWindow + ", cpuRiseThreshold=" + cpuRiseThreshold
                    + ", memorySamples=" + memorySamples
                    + ", memorySlopeThreshold=" + memorySlopeThreshold + '}';
        }
    }

    /** {@code outlier} section: one block per feature family plus the shared seed. */
    public static class OutlierConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private long randomSeed = 42L;
        private OutlierSettings system = OutlierSettings.systemDefaults();
        private NetworkOutlierSettings network = new NetworkOutlierSettings();

        void validate(List<String> errors) {
            system.validate(errors, "outlier.system");
            network.validate(errors, "outlier.network");
        }

        public long getRandomSeed() {
            return randomSeed;
        }

        public void setRandomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
        }

        public OutlierSettings getSystem() {
            return system;
        }

        public void setSystem(OutlierSettings system) {
            this.system = system != null ? system : OutlierSettings.systemDefaults();
        }

        public NetworkOutlierSettings getNetwork() {
            return network;
        }

        public void setNetwork(NetworkOutlierSettings network) {
            this.network = network != null ? network : new NetworkOutlierSettings();
        }

        @Override
        public String toString() {
            return "{randomSeed=" + randomSeed + ", system=" + system + ", network=" + network + '}';
        }
    }

    /**
     * Outlier-model parameters for one feature family, holding the system
     * family's defaults. See {@link NetworkOutlierSettings} for the network block.
     */
    public static class OutlierSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private int minHistory = 50;
        private int window = 50;
        private int minTrainingRows = 11;
        private int trees = 100;
        private double contamination = 0.1;
        private double highSeverityScore = -0.5;

        public static OutlierSettings systemDefaults() {
            return new OutlierSettings();
        }

        public static OutlierSettings networkDefaults() {
            return new NetworkOutlierSettings();
        }

        void validate(List<String> errors, String prefix) {
            if (minHistory <= 0) {
                errors.add(prefix + ".minHistory must be > 0, got " + minHistory);
            }
            if (window < minTrainingRows) {
                errors.add(prefix + ".window (" + window
                        + ") must be >= minTrainingRows (" + minTrainingRows + ")");
            }
            if (minTrainingRows < 2) {
                errors.add(prefix + ".minTrainingRows must be >= 2, got " + minTrainingRows);
            }
            if (trees <= 0) {
                errors.add(prefix + ".trees must be > 0, got " + trees);
            }
            if (contamination <= 0 || contamination >= 0.5) {
                errors.add(prefix + ".contamination must be in (0, 0.5), got " + contamination);
            }
            if (highSeverityScore >= 0) {
                errors.add(prefix + ".highSeverityScore must be < 0, got " + highSeverityScore);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinHistory() {
            return minHistory;
        }

        public void setMinHistory(int minHistory) {
            this.minHistory = minHistory;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public int getMinTrainingRows() {
            return minTrainingRows;
        }

        public void setMinTrainingRows(int minTrainingRows) {
            this.minTrainingRows = minTrainingRows;
        }

        public int getTrees() {
            return trees;
        }

        public void setTrees(int trees) {
            this.trees = trees;
        }

        public double getContamination() {
            return contamination;
        }

        public void setContamination(double contamination) {
            this.contamination = contamination;
        }

        public double getHighSeverityScore() {
            return highSeverityScore;
        }

        public void setHighSeverityScore(double highSeverityScore) {
            this.highSeverityScore = highSeverityScore;
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", minHistory=" + minHistory + ", window=" + window
                    + ", minTrainingRows=" + minTrainingRows + ", trees=" + trees
                    + ", contamination=" + contamination
                    + ", highSeverityScore=" + highSeverityScore + '}';
        }
    }

    /**
     * {@code outlier.network} block. SnakeYAML instantiates the declared
     * property type, so keys left out of the block keep these defaults.
     */
    public static class NetworkOutlierSettings extends OutlierSettings {

        private static final long serialVersionUID = 1L;

        public NetworkOutlierSettings() {
            setMinHistory(30);
            setWindow(30);
            setTrees(50);
            setContamination(0.05);
            setHighSeverityScore(-0.3);
        }
    }

    /** {@code prediction} section. */
    public static class PredictionSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private int minHistory = 10;
        private int window = 10;
        private int minSamples = 5;
        private ResourceLimit disk = ResourceLimit.diskDefaults();
        private MemoryLimit memory = new MemoryLimit();

        void validate(List<String> errors) {
            if (minSamples < 2) {
                errors.add("prediction.minSamples must be >= 2, got " + minSamples);
            }
            if (window < minSamples) {
                errors.add("prediction.window (" + window
                        + ") must be >= minSamples (" + minSamples + ")");
            }
            if (minHistory <= 0) {
                errors.add("prediction.minHistory must be > 0, got " + minHistory);
            }
            disk.validate(errors, "prediction.disk");
            memory.validate(errors, "prediction.memory");
        }

        public int getMinHistory() {
            return minHistory;
        }

        public void setMinHistory(int minHistory) {
            this.minHistory = minHistory;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public ResourceLimit getDisk() {
            return disk;
        }

        public void setDisk(ResourceLimit disk) {
            this.disk = disk != null ? disk : ResourceLimit.diskDefaults();
        }

        public MemoryLimit getMemory() {
            return memory;
        }

        public void setMemory(MemoryLimit memory) {
            this.memory = memory != null ? memory : new MemoryLimit();
        }

        @Override
        public String toString() {
            return "{minHistory=" + minHistory + ", window=" + window + ", minSamples=" + minSamples
                    + ", disk=" + disk + ", memory=" + memory + '}';
        }
    }

    /** Failure limit and extrapolation bounds for one predicted resource; disk defaults. */
    public static class ResourceLimit implements Serializable {

        private static final long serialVersionUID = 1L;

        private double limit = 100;
        private double minSlope = 0.1;
        private double horizon = 100;
        private double confidenceFactor = 10;
        private double confidenceCap = 0.9;

        public static ResourceLimit diskDefaults() {
            return new ResourceLimit();
        }

        void validate(List<String> errors, String prefix) {
            if (limit <= 0) {
                errors.add(prefix + ".limit must be > 0, got " + limit);
            }
            if (minSlope < 0) {
                errors.add(prefix + ".minSlope must be >= 0, got " + minSlope);
            }
            if (horizon <= 0) {
                errors.add(prefix + ".horizon must be > 0, got " + horizon);
            }
            if (confidenceCap <= 0 || confidenceCap > 1) {
                errors.add(prefix + ".confidenceCap must be in (0, 1], got " + confidenceCap);
            }
        }

        public double getLimit() {
            return limit;
        }

        public void setLimit(double limit) {
            this.limit = limit;
        }

        public double getMinSlope() {
            return minSlope;
        }

        public void setMinSlope(double minSlope) {
            this.minSlope = minSlope;
        }

        public double getHorizon() {
            return horizon;
        }

        public void setHorizon(double horizon) {
            this.horizon = horizon;
        }

        public double getConfidenceFactor() {
            return confidenceFactor;
        }

        public void setConfidenceFactor(double confidenceFactor) {
            this.confidenceFactor = confidenceFactor;
        }

        public double getConfidenceCap() {
            return confidenceCap;
        }

        public void setConfidenceCap(double confidenceCap) {
            this.confidenceCap = confidenceCap;
        }

        @Override
        public String toString() {
            return "{limit=" + limit + ", minSlope=" + minSlope + ", horizon=" + horizon
                    + ", confidenceFactor=" + confidenceFactor
                    + ", confidenceCap=" + confidenceCap + '}';
        }
    }

    /** {@code prediction.memory} block with the memory defaults. */
    public static class MemoryLimit extends ResourceLimit {

        private static final long serialVersionUID = 1L;

        public MemoryLimit() {
            setLimit(95);
            setMinSlope(0.5);
            setHorizon(50);
            setConfidenceFactor(5);
            setConfidenceCap(0.85);
        }
    }

    /** {@code alerts} section. */
    public static class AlertSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private long retentionHours = 24;
        private long sweepIntervalSeconds = 300;
        private int historyLimit = 100;

        void validate(List<String> errors) {
            if (retentionHours <= 0) {
                errors.add("alerts.retentionHours must be > 0, got " + retentionHours);
            }
            if (sweepIntervalSeconds <= 0) {
                errors.add("alerts.sweepIntervalSeconds must be > 0, got " + sweepIntervalSeconds);
            }
            if (historyLimit <= 0) {
                errors.add("alerts.historyLimit must be > 0, got " + historyLimit);
            }
        }

        public Duration retention() {
            return Duration.ofHours(retentionHours);
        }

        public Duration sweepInterval() {
            return Duration.ofSeconds(sweepIntervalSeconds);
        }

        public long getRetentionHours() {
            return retentionHours;
        }

        public void setRetentionHours(long retentionHours) {
            this.retentionHours = retentionHours;
        }

        public long getSweepIntervalSeconds() {
            return sweepIntervalSeconds;
        }

        public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
            this.sweepIntervalSeconds = sweepIntervalSeconds;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }

        @Override
        public String toString() {
            return "{retentionHours=" + retentionHours
                    + ", sweepIntervalSeconds=" + sweepIntervalSeconds
                    + ", historyLimit=" + historyLimit + '}';
        }
    }
}
