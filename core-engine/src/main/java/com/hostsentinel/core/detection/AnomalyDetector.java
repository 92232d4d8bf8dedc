package com.hostsentinel.core.detection;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.Snapshot;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 *
 * <p>
 * A detector reads the buffer (which already holds {@code snapshot} as its
 * latest entry) and never mutates it. Detectors are best-effort: missing
 * groups or too little history yield an empty list, never an exception.
 * </p>
 *
 * <p>
 * Implementations may keep a disposable cache (e.g. a fitted model) but must
 * not depend on the order in which the engine runs them.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score one snapshot against the buffered history.
     *
     * @param snapshot the snapshot being ingested
     * @param buffer   history of the snapshot's source, {@code snapshot} included
     * @return findings, possibly empty; never {@code null}
     */
    List<Finding> detect(Snapshot snapshot, TelemetryBuffer buffer);

    /**
     * @return a short name used in logs
     */
    String getName();
}
