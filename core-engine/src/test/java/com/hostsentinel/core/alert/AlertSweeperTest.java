package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertSweeper}.
 */
class AlertSweeperTest {

    @Test
    @DisplayName("A sweep purges expired history through the manager")
    void sweepPurgesExpired() {
        AlertManagerTest.MutableClock clock = new AlertManagerTest.MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        AlertManager manager = new AlertManager((a, f) -> { }, Duration.ofHours(1), clock);
        manager.process("web-01", Finding.builder()
                .type(FindingType.CPU_THRESHOLD_BREACH)
                .severity(Severity.HIGH)
                .description("CPU usage 85.0% exceeds threshold")
                .build());
        manager.resolve("cpu_threshold_breach:web-01");
        clock.advance(Duration.ofHours(2));

        try (AlertSweeper sweeper = new AlertSweeper(manager, Duration.ofMinutes(5))) {
            assertThat(sweeper.sweep()).isEqualTo(1);
            assertThat(sweeper.sweep()).isZero();
        }
        assertThat(manager.listHistory()).isEmpty();
    }

    @Test
    @DisplayName("Starting twice is rejected")
    void startTwiceIsRejected() {
        AlertManager manager = new AlertManager((a, f) -> { }, Duration.ofHours(1),
                Clock.systemUTC());
        try (AlertSweeper sweeper = new AlertSweeper(manager, Duration.ofMinutes(5))) {
            sweeper.start();
            assertThatThrownBy(sweeper::start).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void shouldRejectBadInterval() {
        AlertManager manager = new AlertManager((a, f) -> { }, Duration.ofHours(1),
                Clock.systemUTC());
        assertThatThrownBy(() -> new AlertSweeper(manager, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
