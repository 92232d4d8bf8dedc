package com.hostsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metrics of the Host Sentinel job, exposed through the
 * cluster's configured reporters.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code snapshots_processed_total}: snapshots ingested</li>
 *   <li>{@code findings_emitted_total}: findings produced by the detectors</li>
 *   <li>{@code alerts_opened_total}: alerts created for a new key</li>
 *   <li>{@code alerts_resolved_total}: alerts resolved by command</li>
 *   <li>{@code processing_latency_ms}: per-snapshot latency histogram</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter snapshotsProcessed;
    private final Counter findingsEmitted;
    private final Counter alertsOpened;
    private final Counter alertsResolved;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup("host_sentinel");

        this.snapshotsProcessed = sentinelGroup.counter("snapshots_processed_total");
        this.findingsEmitted = sentinelGroup.counter("findings_emitted_total");
        this.alertsOpened = sentinelGroup.counter("alerts_opened_total");
        this.alertsResolved = sentinelGroup.counter("alerts_resolved_total");
        this.processingLatency = sentinelGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementSnapshotsProcessed() {
        snapshotsProcessed.inc();
    }

    public void incrementFindingsEmitted() {
        findingsEmitted.inc();
    }

    public void incrementAlertsOpened() {
        alertsOpened.inc();
    }

    public void incrementAlertsResolved() {
        alertsResolved.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }

    long snapshotsProcessed() {
        return snapshotsProcessed.getCount();
    }

    long alertsOpened() {
        return alertsOpened.getCount();
    }

    long alertsResolved() {
        return alertsResolved.getCount();
    }
}
