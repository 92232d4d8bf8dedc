package com.hostsentinel.flink;

import com.hostsentinel.core.alert.AlertManager;
import com.hostsentinel.core.alert.AlertSweeper;
import com.hostsentinel.core.alert.AsyncAlertNotifier;
import com.hostsentinel.core.alert.LoggingAlertNotifier;
import com.hostsentinel.core.config.DetectionConfig;
import com.hostsentinel.core.engine.AnomalyEngine;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.Snapshot;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.co.KeyedCoProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link KeyedCoProcessFunction} that feeds telemetry snapshots through
 * the {@link AnomalyEngine} and the {@link AlertManager}, and applies operator
 * commands from the second input.
 *
 * <p>
 * Both inputs are keyed by source id, so a resolve command always reaches the
 * subtask that owns the alert it names.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * The engine and the alert manager live on the operator instance and are
 * rebuilt in {@link #open(Configuration)}. Their state is not checkpointed:
 * a restart starts with empty histories and no active alerts, and detectors
 * warm up again from the incoming stream.
 * </p>
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>one {@code finding} event per finding, carrying the alert state</li>
 *   <li>one {@code resolved} event per successful resolve command</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class TelemetryProcessFunction
        extends KeyedCoProcessFunction<String, Snapshot, AlertCommand, AlertEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryProcessFunction.class);

    private final DetectionConfig config;

    private transient AnomalyEngine engine;
    private transient AlertManager alertManager;
    private transient AsyncAlertNotifier notifier;
    private transient AlertSweeper sweeper;
    private transient SentinelMetrics metrics;

    /**
     * @param config validated detection configuration
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public TelemetryProcessFunction(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "Detection config must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        start(new SentinelMetrics(getRuntimeContext().getMetricGroup()), Clock.systemUTC());
    }

    void start(SentinelMetrics metrics, Clock clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        DetectionConfig.AlertSettings alerts = config.getAlerts();

        engine = new AnomalyEngine(config);
        notifier = new AsyncAlertNotifier(new LoggingAlertNotifier());
        alertManager = new AlertManager(notifier, alerts.retention(), alerts.getHistoryLimit(), clock);
        sweeper = new AlertSweeper(alertManager, alerts.sweepInterval());
        sweeper.start();
        LOG.info("TelemetryProcessFunction opened with history scope {}", config.getHistory().getScope());
    }

    @Override
    public void close() {
        LOG.info("TelemetryProcessFunction closing");
        if (sweeper != null) {
            sweeper.close();
        }
        if (notifier != null) {
            notifier.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement1(Snapshot snapshot, Context ctx, Collector<AlertEvent> out) {
        for (AlertEvent event : onSnapshot(snapshot)) {
            out.collect(event);
        }
    }

    @Override
    public void processElement2(AlertCommand command, Context ctx, Collector<AlertEvent> out) {
        onCommand(command).ifPresent(out::collect);
    }

    List<AlertEvent> onSnapshot(Snapshot snapshot) {
        long startNanos = System.nanoTime();

        List<Finding> findings = engine.ingest(snapshot);
        List<AlertEvent> events = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            Alert alert = alertManager.process(snapshot.getSourceId(), finding);
            if (alert.getCount() == 1) {
                metrics.incrementAlertsOpened();
            }
            metrics.incrementFindingsEmitted();
            events.add(AlertEvent.finding(finding, alert));
        }

        metrics.incrementSnapshotsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
        return events;
    }

    Optional<AlertEvent> onCommand(AlertCommand command) {
        switch (command.getAction()) {
            case RESOLVE:
                Optional<Alert> resolved = alertManager.resolveAlert(command.getKey());
                if (resolved.isEmpty()) {
                    LOG.info("Resolve command for {} had no active alert", command.getKey());
                    return Optional.empty();
                }
                metrics.incrementAlertsResolved();
                return Optional.of(AlertEvent.resolved(resolved.get()));
            default:
                LOG.warn("Unsupported alert command {}", command);
                return Optional.empty();
        }
    }

    AnomalyEngine engine() {
        return engine;
    }

    AlertManager alertManager() {
        return alertManager;
    }
}
