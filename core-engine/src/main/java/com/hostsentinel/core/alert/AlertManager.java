package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertKey;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns findings into deduplicated {@link Alert}s and owns their lifecycle.
 *
 * <h3>State machine (per {@link AlertKey})</h3>
 * <ul>
 * <li>absent &rarr; active: first finding opens an alert with count 1</li>
 * <li>active &rarr; active: a repeat finding bumps {@code lastSeen} and the
 * count; severity and description of the first finding are kept</li>
 * <li>active &rarr; resolved: only through {@link #resolve(AlertKey)}; the
 * alert moves to the history</li>
 * <li>resolved &rarr; purged: {@link #purgeExpired()} drops history entries
 * resolved longer ago than the retention window</li>
 * </ul>
 * <p>
 * A key that fires again after resolution opens a new alert.
 * </p>
 *
 * <h3>Notification</h3>
 * <p>
 * Every {@code critical} finding is passed to the {@link AlertNotifier}
 * after the state change and outside the manager's monitor. Notifier
 * failures are logged and never propagated.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All state changes and reads are serialised on the manager's monitor.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final AlertNotifier notifier;
    private final Duration retention;
    private final int defaultHistoryLimit;
    private final Clock clock;

    private final Map<AlertKey, Alert> active = new LinkedHashMap<>();
    private final List<Alert> history = new ArrayList<>();

    public AlertManager(AlertNotifier notifier, Duration retention, Clock clock) {
        this(notifier, retention, DEFAULT_HISTORY_LIMIT, clock);
    }

    /**
     * @param notifier            side channel for critical findings
     * @param retention           how long resolved alerts stay in the history
     * @param defaultHistoryLimit number of entries {@link #listHistory()} returns
     * @param clock               time source for all timestamps
     */
    public AlertManager(AlertNotifier notifier, Duration retention, int defaultHistoryLimit, Clock clock) {
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive, got " + retention);
        }
        if (defaultHistoryLimit <= 0) {
            throw new IllegalArgumentException("defaultHistoryLimit must be > 0, got " + defaultHistoryLimit);
        }
        this.defaultHistoryLimit = defaultHistoryLimit;
    }

    // ---------------------------------------------------------------
    // Upsert
    // ---------------------------------------------------------------

    /**
     * Record one finding reported by {@code sourceId}.
     *
     * @return the alert state after the finding was recorded
     */
    public Alert process(String sourceId, Finding finding) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(finding, "finding must not be null");

        Alert alert;
        synchronized (this) {
            Instant now = clock.instant();
            AlertKey key = AlertKey.of(finding.getType(), sourceId);
            Alert existing = active.get(key);
            if (existing == null) {
                alert = Alert.open(sourceId, finding, now);
                LOG.info("Alert opened: {} ({}) - {}", key, alert.getSeverity().wireName(), alert.getDescription());
            } else {
                alert = existing.recordOccurrence(now);
                LOG.debug("Alert {} seen again (count={})", key, alert.getCount());
            }
            active.put(key, alert);
        }

        if (finding.getSeverity() == Severity.CRITICAL) {
            try {
                notifier.notify(alert, finding);
            } catch (RuntimeException e) {
                LOG.error("Notification failed for alert {}", alert.getKey(), e);
            }
        }
        return alert;
    }

    /**
     * Record several findings from one source, in order.
     *
     * @return the alert state after each finding
     */
    public List<Alert> processAll(String sourceId, List<Finding> findings) {
        Objects.requireNonNull(findings, "findings must not be null");
        List<Alert> alerts = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            alerts.add(process(sourceId, finding));
        }
        return alerts;
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * Resolve an active alert.
     *
     * @return {@code true} if an active alert was resolved; {@code false} for
     *         an unknown or already resolved key
     */
    public boolean resolve(AlertKey key) {
        return resolveAlert(key).isPresent();
    }

    /**
     * Resolve an alert by the string form of its key, {@code type:source}.
     *
     * @return {@code false} if the key is malformed, unknown or already resolved
     */
    public boolean resolve(String key) {
        Optional<AlertKey> parsed = AlertKey.parse(key);
        if (parsed.isEmpty()) {
            LOG.warn("Ignoring resolve for malformed alert key '{}'", key);
            return false;
        }
        return resolve(parsed.get());
    }

    /**
     * Resolve an active alert and return its resolved state.
     *
     * @return the resolved alert, or empty if nothing was resolved
     */
    public synchronized Optional<Alert> resolveAlert(AlertKey key) {
        Objects.requireNonNull(key, "key must not be null");
        Alert current = active.remove(key);
        if (current == null) {
            LOG.debug("Resolve for {} ignored: no active alert", key);
            return Optional.empty();
        }
        Alert resolved = current.resolve(clock.instant());
        history.add(resolved);
        LOG.info("Alert resolved: {} after {} occurrence(s)", key, resolved.getCount());
        return Optional.of(resolved);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public synchronized Optional<Alert> getActive(AlertKey key) {
        return Optional.ofNullable(active.get(key));
    }

    /**
     * @return active alerts in the order they were opened
     */
    public synchronized List<Alert> listActive() {
        return List.copyOf(active.values());
    }

    /**
     * @return the most recent {@code defaultHistoryLimit} resolved alerts
     */
    public List<Alert> listHistory() {
        return listHistory(defaultHistoryLimit);
    }

    /**
     * @param limit maximum number of entries
     * @return the most recent resolved alerts, most recent last
     */
    public synchronized List<Alert> listHistory(int limit) {
        if (limit <= 0 || history.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, history.size() - limit);
        return Collections.unmodifiableList(new ArrayList<>(history.subList(from, history.size())));
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    /**
     * Drop resolved alerts whose resolution is older than the retention window.
     *
     * @return number of purged alerts
     */
    public synchronized int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int purged = 0;
        Iterator<Alert> it = history.iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            Optional<Instant> resolvedAt = alert.getResolvedAt();
            if (resolvedAt.isPresent() && resolvedAt.get().isBefore(cutoff)) {
                it.remove();
                purged++;
            }
        }
        if (purged > 0) {
            LOG.info("Purged {} resolved alert(s) older than {}", purged, retention);
        }
        return purged;
    }
}
