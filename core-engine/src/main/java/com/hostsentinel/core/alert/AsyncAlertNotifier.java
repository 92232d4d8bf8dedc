package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Decorator that hands every notification to a worker executor, so a slow
 * or failing delegate never holds up alert processing.
 *
 * <p>
 * Delegate failures are logged on the worker and never propagated.
 * Notifications submitted after {@link #close()} are dropped with a warning.
 * </p>
 *
 * @since 1.0.0
 */
public class AsyncAlertNotifier implements AlertNotifier, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncAlertNotifier.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final AlertNotifier delegate;
    private final ExecutorService executor;

    /**
     * Dispatch on a dedicated single daemon thread.
     */
    public AsyncAlertNotifier(AlertNotifier delegate) {
        this(delegate, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-notifier");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * @param executor the executor to dispatch on; shut down by {@link #close()}
     */
    public AsyncAlertNotifier(AlertNotifier delegate, ExecutorService executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public void notify(Alert alert, Finding finding) {
        try {
            executor.execute(() -> {
                try {
                    delegate.notify(alert, finding);
                } catch (RuntimeException e) {
                    LOG.error("Notifier {} failed for alert {}",
                            delegate.getClass().getSimpleName(), alert.getKey(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Notification for alert {} dropped: notifier is shut down", alert.getKey());
        }
    }

    /**
     * Stop accepting notifications and wait briefly for queued ones.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Alert notifier did not drain within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
