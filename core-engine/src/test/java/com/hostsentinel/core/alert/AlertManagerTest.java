package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertKey;
import com.hostsentinel.core.model.AlertStatus;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private MutableClock clock;
    private List<Alert> notified;
    private AlertManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        notified = new ArrayList<>();
        manager = new AlertManager((alert, finding) -> notified.add(alert), Duration.ofHours(24), clock);
    }

    private static Finding finding(FindingType type, Severity severity) {
        return Finding.builder()
                .type(type)
                .severity(severity)
                .value(90)
                .description(type.wireName() + " fired")
                .build();
    }

    @Test
    @DisplayName("Repeat findings for the same key deduplicate into one alert")
    void shouldDeduplicate() {
        manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));
        clock.advance(Duration.ofSeconds(30));
        Alert alert = manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.CRITICAL));

        assertThat(alert.getCount()).isEqualTo(2);
        assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.getLastSeen()).isEqualTo(clock.instant());
        assertThat(manager.listActive()).hasSize(1);
    }

    @Test
    @DisplayName("Different sources or types open separate alerts")
    void shouldSeparateKeys() {
        manager.processAll("web-01", List.of(
                finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH),
                finding(FindingType.DISK_THRESHOLD_BREACH, Severity.HIGH)));
        manager.process("db-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));

        assertThat(manager.listActive()).extracting(a -> a.getKey().toString()).containsExactly(
                "cpu_threshold_breach:web-01",
                "disk_threshold_breach:web-01",
                "cpu_threshold_breach:db-01");
    }

    @Test
    @DisplayName("Resolve moves the alert to history; a second resolve is a no-op")
    void shouldResolveOnce() {
        manager.process("web-01", finding(FindingType.MEMORY_LEAK_PATTERN, Severity.HIGH));
        AlertKey key = AlertKey.of(FindingType.MEMORY_LEAK_PATTERN, "web-01");

        assertThat(manager.resolve(key)).isTrue();
        assertThat(manager.resolve(key)).isFalse();
        assertThat(manager.getActive(key)).isEmpty();
        assertThat(manager.listHistory()).singleElement().satisfies(a -> {
            assertThat(a.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(a.getResolvedAt()).contains(clock.instant());
        });
    }

    @Test
    @DisplayName("A key that fires after resolution opens a fresh alert")
    void shouldReopenAfterResolve() {
        manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));
        manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));
        manager.resolve("cpu_threshold_breach:web-01");

        Alert reopened = manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));

        assertThat(reopened.getCount()).isEqualTo(1);
        assertThat(manager.listHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Malformed or unknown string keys resolve nothing")
    void shouldIgnoreMalformedKey() {
        assertThat(manager.resolve("garbage")).isFalse();
        assertThat(manager.resolve("cpu_threshold_breach:nobody")).isFalse();
    }

    @Test
    @DisplayName("Only critical findings reach the notifier")
    void shouldNotifyCriticalOnly() {
        manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));
        manager.process("web-01", finding(FindingType.DISK_THRESHOLD_BREACH, Severity.CRITICAL));
        manager.process("web-01", finding(FindingType.DISK_THRESHOLD_BREACH, Severity.CRITICAL));

        assertThat(notified).hasSize(2);
        assertThat(notified.get(1).getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A failing notifier does not break processing")
    void shouldSwallowNotifierFailure() {
        AlertManager failing = new AlertManager((alert, finding) -> {
            throw new IllegalStateException("smtp down");
        }, Duration.ofHours(1), clock);

        Alert alert = failing.process("web-01", finding(FindingType.DISK_THRESHOLD_BREACH, Severity.CRITICAL));

        assertThat(alert.isActive()).isTrue();
        assertThat(failing.listActive()).hasSize(1);
    }

    @Test
    @DisplayName("Purge drops resolved alerts older than the retention window")
    void shouldPurgeExpired() {
        manager.process("web-01", finding(FindingType.CPU_THRESHOLD_BREACH, Severity.HIGH));
        manager.resolve("cpu_threshold_breach:web-01");
        clock.advance(Duration.ofHours(12));
        manager.process("web-01", finding(FindingType.DISK_THRESHOLD_BREACH, Severity.HIGH));
        manager.resolve("disk_threshold_breach:web-01");

        clock.advance(Duration.ofHours(13));

        assertThat(manager.purgeExpired()).isEqualTo(1);
        assertThat(manager.listHistory()).extracting(Alert::getType)
                .containsExactly(FindingType.DISK_THRESHOLD_BREACH);
    }

    @Test
    @DisplayName("History listing returns the most recent entries, newest last")
    void shouldLimitHistory() {
        for (FindingType type : List.of(FindingType.CPU_THRESHOLD_BREACH,
                FindingType.MEMORY_THRESHOLD_BREACH, FindingType.DISK_THRESHOLD_BREACH)) {
            manager.process("web-01", finding(type, Severity.HIGH));
            manager.resolve(AlertKey.of(type, "web-01"));
        }

        assertThat(manager.listHistory(2)).extracting(Alert::getType)
                .containsExactly(FindingType.MEMORY_THRESHOLD_BREACH, FindingType.DISK_THRESHOLD_BREACH);
        assertThat(manager.listHistory(0)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive retention")
    void shouldRejectBadRetention() {
        assertThatThrownBy(() -> new AlertManager((a, f) -> { }, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /** Test clock that only moves when told to. */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
