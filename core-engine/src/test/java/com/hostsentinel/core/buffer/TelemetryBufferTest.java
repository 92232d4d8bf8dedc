package com.hostsentinel.core.buffer;

import com.hostsentinel.core.model.MetricGroup;
import com.hostsentinel.core.model.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TelemetryBuffer}.
 */
class TelemetryBufferTest {

    private static Snapshot snapshot(double cpu) {
        return Snapshot.builder()
                .sourceId("web-01")
                .timestamp(Instant.now())
                .cpu("usage_percent", cpu)
                .build();
    }

    private static double cpuOf(Snapshot s) {
        return s.getValueOrZero(MetricGroup.CPU, "usage_percent");
    }

    @Test
    @DisplayName("Should evict the oldest snapshots beyond capacity")
    void shouldEvictOldest() {
        TelemetryBuffer buffer = new TelemetryBuffer(5);
        for (int i = 0; i < 8; i++) {
            buffer.append(snapshot(i));
        }

        assertThat(buffer.size()).isEqualTo(5);
        assertThat(buffer.recent(5)).extracting(TelemetryBufferTest::cpuOf)
                .containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
    }

    @Test
    @DisplayName("recent(k) returns the newest k, oldest first, clamped to size")
    void recentIsClamped() {
        TelemetryBuffer buffer = new TelemetryBuffer(10);
        for (int i = 0; i < 4; i++) {
            buffer.append(snapshot(i));
        }

        assertThat(buffer.recent(2)).extracting(TelemetryBufferTest::cpuOf).containsExactly(2.0, 3.0);
        assertThat(buffer.recent(100)).hasSize(4);
        assertThat(buffer.recent(0)).isEmpty();
        assertThat(buffer.recent(-1)).isEmpty();
    }

    @Test
    @DisplayName("recent(k) is a copy that later appends do not change")
    void recentIsSnapshotCopy() {
        TelemetryBuffer buffer = new TelemetryBuffer(3);
        buffer.append(snapshot(1));
        List<Snapshot> view = buffer.recent(3);

        buffer.append(snapshot(2));

        assertThat(view).hasSize(1);
        assertThatThrownBy(() -> view.add(snapshot(9))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("latest() is empty until something is appended")
    void latestTracksNewest() {
        TelemetryBuffer buffer = new TelemetryBuffer();
        assertThat(buffer.latest()).isEmpty();
        assertThat(buffer.capacity()).isEqualTo(TelemetryBuffer.DEFAULT_CAPACITY);

        buffer.append(snapshot(1));
        buffer.append(snapshot(2));

        assertThat(buffer.latest()).hasValueSatisfying(s -> assertThat(cpuOf(s)).isEqualTo(2.0));
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new TelemetryBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
