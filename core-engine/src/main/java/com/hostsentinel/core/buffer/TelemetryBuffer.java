package com.hostsentinel.core.buffer;

import com.hostsentinel.core.model.Snapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded rolling history of the most recent snapshots.
 *
 * <p>
 * Appending to a full buffer evicts the oldest entry without notice. The
 * retained history is advisory context for the detectors, not a durable
 * record.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods synchronise on the buffer, so {@link #recent(int)} always
 * returns a consistent copy even while another thread appends.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryBuffer {

    /** Default number of retained snapshots. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final ArrayDeque<Snapshot> snapshots;
    private final int capacity;

    public TelemetryBuffer() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of retained snapshots; must be positive
     */
    public TelemetryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void append(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (snapshots.size() >= capacity) {
            snapshots.removeFirst(); // evict oldest
        }
        snapshots.addLast(snapshot);
    }

    /**
     * Return the last {@code k} snapshots, oldest first.
     *
     * @param k number of snapshots wanted; clamped to the current size
     * @return an unmodifiable copy, empty if the buffer is empty or {@code k <= 0}
     */
    public synchronized List<Snapshot> recent(int k) {
        int n = Math.min(Math.max(k, 0), snapshots.size());
        if (n == 0) {
            return List.of();
        }
        List<Snapshot> out = new ArrayList<>(n);
        Iterator<Snapshot> it = snapshots.descendingIterator();
        while (out.size() < n) {
            out.add(it.next());
        }
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }

    public synchronized Optional<Snapshot> latest() {
        return Optional.ofNullable(snapshots.peekLast());
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public int capacity() {
        return capacity;
    }
}
