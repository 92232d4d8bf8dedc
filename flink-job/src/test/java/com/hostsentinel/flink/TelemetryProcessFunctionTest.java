package com.hostsentinel.flink;

import com.hostsentinel.core.config.DetectionConfig;
import com.hostsentinel.core.model.AlertKey;
import com.hostsentinel.core.model.AlertStatus;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.Severity;
import com.hostsentinel.core.model.Snapshot;
import org.apache.flink.metrics.groups.UnregisteredMetricsGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TelemetryProcessFunction}, driven without a Flink
 * runtime.
 */
class TelemetryProcessFunctionTest {

    private TelemetryProcessFunction function;
    private SentinelMetrics metrics;

    @BeforeEach
    void setUp() {
        function = new TelemetryProcessFunction(new DetectionConfig());
        metrics = new SentinelMetrics(new UnregisteredMetricsGroup());
        function.start(metrics, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        function.close();
    }

    private static Snapshot cpu(String sourceId, double usage) {
        return Snapshot.builder()
                .sourceId(sourceId)
                .timestamp(Instant.now())
                .cpu("usage_percent", usage)
                .build();
    }

    @Test
    @DisplayName("Each finding becomes a finding event with its alert state")
    void shouldEmitFindingEvents() {
        List<AlertEvent> first = function.onSnapshot(cpu("web-01", 97));
        List<AlertEvent> second = function.onSnapshot(cpu("web-01", 97));

        assertThat(first).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(AlertEvent.Type.FINDING);
            assertThat(e.getFinding()).hasValueSatisfying(
                    f -> assertThat(f.getSeverity()).isEqualTo(Severity.CRITICAL));
            assertThat(e.getAlert().getCount()).isEqualTo(1);
        });
        assertThat(second).singleElement()
                .satisfies(e -> assertThat(e.getAlert().getCount()).isEqualTo(2));
        assertThat(metrics.snapshotsProcessed()).isEqualTo(2);
        assertThat(metrics.alertsOpened()).isEqualTo(1);
    }

    @Test
    @DisplayName("Quiet snapshots emit nothing")
    void quietSnapshotsEmitNothing() {
        assertThat(function.onSnapshot(cpu("web-01", 12))).isEmpty();
        assertThat(function.engine().historySize("web-01")).isEqualTo(1);
    }

    @Test
    @DisplayName("A resolve command emits a resolved event once")
    void shouldResolveByCommand() {
        function.onSnapshot(cpu("web-01", 85));
        AlertCommand command = AlertCommand.resolve(AlertKey.of(FindingType.CPU_THRESHOLD_BREACH, "web-01"));

        Optional<AlertEvent> resolved = function.onCommand(command);
        Optional<AlertEvent> again = function.onCommand(command);

        assertThat(resolved).hasValueSatisfying(e -> {
            assertThat(e.getType()).isEqualTo(AlertEvent.Type.RESOLVED);
            assertThat(e.getAlert().getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(e.getFinding()).isEmpty();
        });
        assertThat(again).isEmpty();
        assertThat(metrics.alertsResolved()).isEqualTo(1);
        assertThat(function.alertManager().listActive()).isEmpty();
    }

    @Test
    @DisplayName("Alerts are tracked per source")
    void alertsArePerSource() {
        function.onSnapshot(cpu("web-01", 85));
        function.onSnapshot(cpu("web-02", 85));

        assertThat(function.alertManager().listActive()).extracting(a -> a.getSourceId())
                .containsExactly("web-01", "web-02");
    }
}
