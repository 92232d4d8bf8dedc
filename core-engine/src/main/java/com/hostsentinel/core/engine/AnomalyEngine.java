package com.hostsentinel.core.engine;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.config.DetectionConfig;
import com.hostsentinel.core.config.DetectionConfig.HistoryScope;
import com.hostsentinel.core.config.DetectionConfig.PredictionSettings;
import com.hostsentinel.core.config.DetectionConfig.ResourceLimit;
import com.hostsentinel.core.config.DetectionConfig.ThresholdSettings;
import com.hostsentinel.core.detection.AnomalyDetector;
import com.hostsentinel.core.detection.DetectorFactory;
import com.hostsentinel.core.detection.LinearTrend;
import com.hostsentinel.core.engine.PerformanceInsights.Direction;
import com.hostsentinel.core.engine.PerformanceInsights.ResourceTrend;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.MetricGroup;
import com.hostsentinel.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs the detector set over every ingested snapshot and answers health,
 * failure-prediction and performance queries over the buffered history.
 *
 * <h3>Histories</h3>
 * <p>
 * With {@link HistoryScope#PER_SOURCE} (the default) every source gets its
 * own {@link TelemetryBuffer} and its own detector instances, so model
 * caches never mix sources. With {@link HistoryScope#SHARED} all sources
 * share one window under the key {@value #SHARED_HISTORY}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Ingest into one history is serialised by that history's lock, so a
 * detector pass always sees a buffer no other ingest is appending to.
 * Different sources proceed in parallel. Queries read consistent buffer
 * copies and take no history lock.
 * </p>
 *
 * <h3>Idle sources</h3>
 * <p>
 * A history that has not ingested for {@code history.idleEvictionMinutes}
 * is dropped together with its detectors and cached models. Ingest scans
 * for idle histories at most once per minute; {@link #evictIdle()} runs the
 * scan on demand.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    /** History key used when all sources share one window. */
    public static final String SHARED_HISTORY = "*";

    static final String USAGE_FIELD = "usage_percent";

    // Health gauge penalties, per component: critical / warning
    private static final int CPU_CRITICAL_PENALTY = 30;
    private static final int CPU_WARNING_PENALTY = 10;
    private static final int MEMORY_CRITICAL_PENALTY = 25;
    private static final int MEMORY_WARNING_PENALTY = 10;
    private static final int DISK_CRITICAL_PENALTY = 35;
    private static final int DISK_WARNING_PENALTY = 15;

    // Performance insights
    static final int INSIGHT_WINDOW = 10;
    private static final int INSIGHT_EDGE = 3;
    private static final double STABLE_BAND = 5.0;
    private static final double CPU_INSIGHT_CHANGE = 10.0;
    private static final double MEMORY_INSIGHT_CHANGE = 8.0;

    private static final Duration EVICTION_SCAN_INTERVAL = Duration.ofMinutes(1);

    private final DetectionConfig config;
    private final Supplier<List<AnomalyDetector>> detectorSupplier;
    private final Clock clock;
    private final Map<String, History> histories = new ConcurrentHashMap<>();
    private volatile String lastHistoryKey;
    private volatile Instant nextEvictionScan;

    public AnomalyEngine(DetectionConfig config) {
        this(config, () -> DetectorFactory.createAll(config), Clock.systemUTC());
    }

    AnomalyEngine(DetectionConfig config, Supplier<List<AnomalyDetector>> detectorSupplier) {
        this(config, detectorSupplier, Clock.systemUTC());
    }

    /**
     * @param detectorSupplier creates the detector list of each new history
     * @param clock            time source for idle eviction
     */
    AnomalyEngine(DetectionConfig config, Supplier<List<AnomalyDetector>> detectorSupplier, Clock clock) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.detectorSupplier = Objects.requireNonNull(detectorSupplier, "detectorSupplier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.nextEvictionScan = clock.instant().plus(EVICTION_SCAN_INTERVAL);
        LOG.info("Anomaly engine created (history scope={}, capacity={})",
                config.getHistory().getScope(), config.getHistory().getCapacity());
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Append the snapshot to its history and run every detector over it.
     *
     * <p>
     * A detector that throws is logged and skipped; the remaining detectors
     * still run.
     * </p>
     *
     * @return the merged findings of all detectors, possibly empty
     */
    public List<Finding> ingest(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        String key = historyKey(snapshot.getSourceId());
        Instant now = clock.instant();
        History history = histories.compute(key, (k, existing) -> {
            History h = existing != null ? existing : newHistory(k);
            h.lastIngest = now;
            return h;
        });

        List<Finding> findings = new ArrayList<>();
        history.lock.lock();
        try {
            history.buffer.append(snapshot);
            for (AnomalyDetector detector : history.detectors) {
                try {
                    findings.addAll(detector.detect(snapshot, history.buffer));
                } catch (RuntimeException e) {
                    LOG.error("Detector [{}] failed on snapshot from {}",
                            detector.getName(), snapshot.getSourceId(), e);
                }
            }
        } finally {
            history.lock.unlock();
        }
        lastHistoryKey = key;
        if (!now.isBefore(nextEvictionScan)) {
            nextEvictionScan = now.plus(EVICTION_SCAN_INTERVAL);
            evictIdle();
        }

        if (!findings.isEmpty()) {
            LOG.debug("{} finding(s) for {}", findings.size(), snapshot.getSourceId());
        }
        return Collections.unmodifiableList(findings);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return health of the most recently ingested history
     */
    public HealthReport healthScore() {
        String key = lastHistoryKey;
        return key == null ? HealthReport.insufficientData() : healthOf(histories.get(key));
    }

    public HealthReport healthScore(String sourceId) {
        return healthOf(histories.get(historyKey(sourceId)));
    }

    /**
     * @return forecast for the most recently ingested history
     */
    public FailureForecast predictFailure() {
        String key = lastHistoryKey;
        return key == null ? FailureForecast.none() : forecastOf(histories.get(key));
    }

    public FailureForecast predictFailure(String sourceId) {
        return forecastOf(histories.get(historyKey(sourceId)));
    }

    /**
     * Cpu and memory trends over the last {@value #INSIGHT_WINDOW}
     * snapshots; empty for a shorter history.
     */
    public PerformanceInsights performanceInsights(String sourceId) {
        History history = histories.get(historyKey(sourceId));
        if (history == null) {
            return PerformanceInsights.empty();
        }
        return insightsOf(history.buffer.recent(INSIGHT_WINDOW));
    }

    /**
     * Drop every history whose last ingest is older than the idle window.
     *
     * @return number of histories dropped
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(config.getHistory().idleEviction());
        int evicted = 0;
        for (String key : histories.keySet()) {
            boolean[] removed = new boolean[1];
            histories.computeIfPresent(key, (k, h) -> {
                removed[0] = h.lastIngest.isBefore(cutoff);
                return removed[0] ? null : h;
            });
            if (removed[0]) {
                evicted++;
                LOG.info("Dropped idle history '{}'", key);
            }
        }
        return evicted;
    }

    /**
     * @return the keys of all tracked histories, sorted
     */
    public Set<String> sources() {
        return Collections.unmodifiableSet(new TreeSet<>(histories.keySet()));
    }

    /**
     * @return number of buffered snapshots in the source's history, 0 if unknown
     */
    public int historySize(String sourceId) {
        History history = histories.get(historyKey(sourceId));
        return history == null ? 0 : history.buffer.size();
    }

    // ---------------------------------------------------------------
    // Health gauge
    // ---------------------------------------------------------------

    private HealthReport healthOf(History history) {
        if (history == null) {
            return HealthReport.insufficientData();
        }
        Optional<Snapshot> latest = history.buffer.latest();
        if (latest.isEmpty()) {
            return HealthReport.insufficientData();
        }

        Snapshot snapshot = latest.get();
        ThresholdSettings t = config.getThresholds();
        List<HealthIssue> critical = new ArrayList<>();
        List<HealthIssue> warnings = new ArrayList<>();
        Map<MetricGroup, Double> scores = new EnumMap<>(MetricGroup.class);
        int overall = 100;

        overall -= gauge(snapshot, MetricGroup.CPU, "CPU", t.getCpuWarning(), t.getCpuCritical(),
                CPU_WARNING_PENALTY, CPU_CRITICAL_PENALTY, "System may become unresponsive",
                critical, warnings, scores);
        overall -= gauge(snapshot, MetricGroup.MEMORY, "memory", t.getMemoryWarning(), t.getMemoryCritical(),
                MEMORY_WARNING_PENALTY, MEMORY_CRITICAL_PENALTY, "Risk of out-of-memory errors",
                critical, warnings, scores);
        overall -= gauge(snapshot, MetricGroup.DISK, "disk", t.getDiskWarning(), t.getDiskCritical(),
                DISK_WARNING_PENALTY, DISK_CRITICAL_PENALTY, "System may fail to write data",
                critical, warnings, scores);

        HealthStatus status = !critical.isEmpty()
                ? HealthStatus.CRITICAL
                : !warnings.isEmpty() ? HealthStatus.WARNING : HealthStatus.HEALTHY;
        return new HealthReport(status, critical, warnings, overall, scores);
    }

    /**
     * @return the penalty to subtract from the overall score
     */
    private static int gauge(Snapshot snapshot, MetricGroup group, String label,
            double warning, double critical, int warningPenalty, int criticalPenalty, String impact,
            List<HealthIssue> criticalIssues, List<HealthIssue> warnings, Map<MetricGroup, Double> scores) {
        if (!snapshot.hasGroup(group)) {
            return 0;
        }
        double usage = snapshot.getValueOrZero(group, USAGE_FIELD);
        scores.put(group, Math.max(0.0, 100.0 - usage));

        if (usage > critical) {
            criticalIssues.add(new HealthIssue(group, "Critical " + label + " usage", usage, impact));
            return criticalPenalty;
        }
        if (usage > warning) {
            warnings.add(new HealthIssue(group, "High " + label + " usage", usage, null));
            return warningPenalty;
        }
        return 0;
    }

    // ---------------------------------------------------------------
    // Failure prediction
    // ---------------------------------------------------------------

    private FailureForecast forecastOf(History history) {
        PredictionSettings p = config.getPrediction();
        if (history == null || history.buffer.size() < p.getMinHistory()) {
            return FailureForecast.none();
        }

        List<Snapshot> window = history.buffer.recent(p.getWindow());
        Snapshot latest = window.get(window.size() - 1);
        Map<MetricGroup, FailurePrediction> predictions = new EnumMap<>(MetricGroup.class);
        forecast(latest, window, MetricGroup.DISK, p.getDisk(), p.getMinSamples())
                .ifPresent(f -> predictions.put(MetricGroup.DISK, f));
        forecast(latest, window, MetricGroup.MEMORY, p.getMemory(), p.getMinSamples())
                .ifPresent(f -> predictions.put(MetricGroup.MEMORY, f));
        return new FailureForecast(predictions);
    }

    private static Optional<FailurePrediction> forecast(Snapshot latest, List<Snapshot> window,
            MetricGroup group, ResourceLimit limit, int minSamples) {
        if (!latest.hasGroup(group)) {
            return Optional.empty();
        }
        List<Double> usage = usages(window, group);
        if (usage.size() < minSamples) {
            return Optional.empty();
        }

        double slope = LinearTrend.slope(usage);
        if (slope <= limit.getMinSlope()) {
            return Optional.empty();
        }
        double current = usage.get(usage.size() - 1);
        double timeToFailure = (limit.getLimit() - current) / slope;
        if (timeToFailure >= limit.getHorizon()) {
            return Optional.empty();
        }

        double confidence = Math.min(limit.getConfidenceCap(), slope * limit.getConfidenceFactor());
        long intervals = Math.max(0L, (long) timeToFailure);
        LOG.debug("{} forecast for {}: slope={} ttf={} confidence={}",
                group.wireName(), latest.getSourceId(), slope, intervals, confidence);
        return Optional.of(new FailurePrediction(intervals, confidence, current, slope));
    }

    // ---------------------------------------------------------------
    // Performance insights
    // ---------------------------------------------------------------

    private static PerformanceInsights insightsOf(List<Snapshot> recent) {
        if (recent.size() < INSIGHT_WINDOW) {
            return PerformanceInsights.empty();
        }

        List<Double> cpu = usagesOrZero(recent, MetricGroup.CPU);
        List<Double> memory = usagesOrZero(recent, MetricGroup.MEMORY);
        ResourceTrend cpuTrend = trendOf(cpu);
        ResourceTrend memoryTrend = trendOf(memory);

        Map<MetricGroup, ResourceTrend> trends = new EnumMap<>(MetricGroup.class);
        trends.put(MetricGroup.CPU, cpuTrend);
        trends.put(MetricGroup.MEMORY, memoryTrend);

        List<String> insights = new ArrayList<>(2);
        List<String> recommendations = new ArrayList<>(2);
        if (cpuTrend.change() > CPU_INSIGHT_CHANGE) {
            insights.add("CPU usage has increased significantly in recent measurements");
            recommendations.add("Consider investigating processes causing increased CPU usage");
        }
        if (memoryTrend.change() > MEMORY_INSIGHT_CHANGE) {
            insights.add("Memory usage shows concerning upward trend");
            recommendations.add("Monitor for potential memory leaks");
        }

        double efficiency = 100 - (cpuTrend.average() * 0.4
                + memoryTrend.average() * 0.4
                + Math.max(0, cpuTrend.change()) * 0.2);
        int score = Math.max(0, (int) efficiency);
        return new PerformanceInsights(trends, insights, recommendations, score);
    }

    private static ResourceTrend trendOf(List<Double> values) {
        int n = values.size();
        double change = LinearTrend.mean(values, n - INSIGHT_EDGE, n) - LinearTrend.mean(values, 0, INSIGHT_EDGE);
        Direction direction = change > STABLE_BAND
                ? Direction.INCREASING
                : change < -STABLE_BAND ? Direction.DECREASING : Direction.STABLE;
        return new ResourceTrend(direction, change, LinearTrend.mean(values, 0, n));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String historyKey(String sourceId) {
        return config.getHistory().getScope() == HistoryScope.SHARED
                ? SHARED_HISTORY
                : Objects.requireNonNull(sourceId, "sourceId must not be null");
    }

    private History newHistory(String key) {
        LOG.info("Tracking new history '{}'", key);
        return new History(new TelemetryBuffer(config.getHistory().getCapacity()),
                detectorSupplier.get());
    }

    /** Usage of every snapshot that carries the group. */
    private static List<Double> usages(List<Snapshot> snapshots, MetricGroup group) {
        List<Double> values = new ArrayList<>(snapshots.size());
        for (Snapshot s : snapshots) {
            if (s.hasGroup(group)) {
                values.add(s.getValueOrZero(group, USAGE_FIELD));
            }
        }
        return values;
    }

    /** Usage of every snapshot, 0 where the group is missing. */
    private static List<Double> usagesOrZero(List<Snapshot> snapshots, MetricGroup group) {
        List<Double> values = new ArrayList<>(snapshots.size());
        for (Snapshot s : snapshots) {
            values.add(s.getValueOrZero(group, USAGE_FIELD));
        }
        return values;
    }

    private static final class History {
        final ReentrantLock lock = new ReentrantLock();
        final TelemetryBuffer buffer;
        final List<AnomalyDetector> detectors;
        volatile Instant lastIngest;

        History(TelemetryBuffer buffer, List<AnomalyDetector> detectors) {
            this.buffer = buffer;
            this.detectors = detectors;
        }
    }
}
