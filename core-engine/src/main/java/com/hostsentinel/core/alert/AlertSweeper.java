package com.hostsentinel.core.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic timer that purges expired resolved alerts, decoupled from the
 * ingest path.
 *
 * @since 1.0.0
 */
public class AlertSweeper implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSweeper.class);

    private final AlertManager alertManager;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private boolean started;

    public AlertSweeper(AlertManager alertManager, Duration interval) {
        this.alertManager = Objects.requireNonNull(alertManager, "alertManager must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule the sweep every {@code interval}, first run one interval from now.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Alert sweeper already started");
        }
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        started = true;
        LOG.info("Alert sweeper started (interval={})", interval);
    }

    /**
     * Run one sweep on the calling thread.
     *
     * @return number of purged alerts, 0 if the sweep failed
     */
    int sweep() {
        try {
            return alertManager.purgeExpired();
        } catch (RuntimeException e) {
            LOG.error("Alert sweep failed", e);
            return 0;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        LOG.info("Alert sweeper stopped");
    }
}
