package com.hostsentinel.core.detection;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.config.DetectionConfig.ThresholdSettings;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.MetricGroup;
import com.hostsentinel.core.model.Severity;
import com.hostsentinel.core.model.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThresholdDetector}.
 */
class ThresholdDetectorTest {

    private ThresholdDetector detector;
    private TelemetryBuffer buffer;

    @BeforeEach
    void setUp() {
        detector = new ThresholdDetector(new ThresholdSettings());
        buffer = new TelemetryBuffer(10);
    }

    private static Snapshot.Builder base() {
        return Snapshot.builder().sourceId("web-01").timestamp(Instant.now());
    }

    @Test
    @DisplayName("Should fire CRITICAL above the critical limit")
    void shouldFireCritical() {
        List<Finding> findings = detector.detect(base().cpu("usage_percent", 96).build(), buffer);

        assertThat(findings).hasSize(1);
        Finding f = findings.get(0);
        assertThat(f.getType()).isEqualTo(FindingType.CPU_THRESHOLD_BREACH);
        assertThat(f.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(f.getValue()).isEqualTo(96.0);
        assertThat(f.getThreshold()).hasValue(80.0);
        assertThat(f.getDescription()).isEqualTo("CPU usage 96.0% exceeds threshold");
        assertThat(f.getSuggestedAction()).isEqualTo("identify_cpu_intensive_processes");
    }

    @Test
    @DisplayName("Should fire HIGH between warning and critical")
    void shouldFireHigh() {
        List<Finding> findings = detector.detect(base().cpu("usage_percent", 82).build(), buffer);

        assertThat(findings).singleElement()
                .satisfies(f -> assertThat(f.getSeverity()).isEqualTo(Severity.HIGH));
    }

    @Test
    @DisplayName("Limits are exclusive: a value at the warning limit does not fire")
    void shouldNotFireAtLimit() {
        assertThat(detector.detect(base().cpu("usage_percent", 80).build(), buffer)).isEmpty();
        assertThat(detector.detect(base().cpu("usage_percent", 50).build(), buffer)).isEmpty();
    }

    @Test
    @DisplayName("Should fire MEDIUM on high network latency")
    void shouldFireOnLatency() {
        List<Finding> findings = detector.detect(base().network("latency_ms", 250).build(), buffer);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.getType()).isEqualTo(FindingType.NETWORK_LATENCY_HIGH);
            assertThat(f.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(f.getDescription()).isEqualTo("Network latency 250.0ms exceeds threshold");
        });
    }

    @Test
    @DisplayName("Should report every breached resource")
    void shouldReportMultipleBreaches() {
        Snapshot snapshot = base()
                .cpu("usage_percent", 90)
                .memory("usage_percent", 97)
                .disk("usage_percent", 99)
                .build();

        List<Finding> findings = detector.detect(snapshot, buffer);

        assertThat(findings).extracting(Finding::getType).containsExactly(
                FindingType.CPU_THRESHOLD_BREACH,
                FindingType.MEMORY_THRESHOLD_BREACH,
                FindingType.DISK_THRESHOLD_BREACH);
        assertThat(findings).extracting(Finding::getSeverity)
                .containsExactly(Severity.HIGH, Severity.CRITICAL, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Absent groups are skipped, missing fields count as zero")
    void absentGroupsAreSkipped() {
        Snapshot snapshot = base().group(MetricGroup.CPU).build();

        assertThat(detector.detect(snapshot, buffer)).isEmpty();
        assertThat(detector.getName()).isEqualTo("threshold");
    }
}
