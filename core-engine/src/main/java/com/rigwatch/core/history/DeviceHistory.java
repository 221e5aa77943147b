package com.rigwatch.core.history;

import com.rigwatch.core.model.TelemetryEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, ordered window of one device's telemetry.
 *
 * <p>
 * Backed by a fixed-size ring buffer indexed by a write cursor: appending
 * never allocates once the buffer exists, and the oldest reading is
 * overwritten when the buffer is full. Insertion order is arrival order.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Guarded by a {@link ReentrantReadWriteLock}. Every read method copies the
 * requested range under the read lock, so readers never observe a
 * half-applied append.
 * </p>
 *
 * @since 1.0.0
 */
public class DeviceHistory {

    private final String deviceId;
    private final TelemetryEvent[] slots;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Index the next append writes to. */
    private int cursor;
    private int size;

    /**
     * @param deviceId device this history belongs to
     * @param capacity maximum number of retained events; must be &gt; 0
     */
    public DeviceHistory(String deviceId, int capacity) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.slots = new TelemetryEvent[capacity];
    }

    /**
     * Append an event, evicting the oldest one when at capacity.
     *
     * @param event the event; must belong to this device
     */
    public void append(TelemetryEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!deviceId.equals(event.getDeviceId())) {
            throw new IllegalArgumentException("Event for device '" + event.getDeviceId()
                    + "' appended to history of '" + deviceId + "'");
        }
        lock.writeLock().lock();
        try {
            slots[cursor] = event;
            cursor = (cursor + 1) % slots.length;
            if (size < slots.length) {
                size++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The last {@code n} events in chronological order. Returns fewer when the
     * history holds fewer.
     *
     * @param n number of events; negative values are treated as zero
     * @return new list, oldest first
     */
    public List<TelemetryEvent> recent(int n) {
        lock.readLock().lock();
        try {
            return copyLast(Math.max(0, Math.min(n, size)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Events whose timestamp is within {@code seconds} of the newest event.
     *
     * @param seconds window length
     * @return new list, oldest first; empty when the history is empty
     */
    public List<TelemetryEvent> window(double seconds) {
        lock.readLock().lock();
        try {
            if (size == 0) {
                return Collections.emptyList();
            }
            return windowLocked(seconds, newestLocked().getTimestamp());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Events with {@code timestamp >= now - seconds}.
     *
     * @param seconds window length
     * @param now     reference time in epoch seconds
     * @return new list, oldest first
     */
    public List<TelemetryEvent> window(double seconds, double now) {
        lock.readLock().lock();
        try {
            return windowLocked(seconds, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copy of every retained event, oldest first
     */
    public List<TelemetryEvent> snapshot() {
        return recent(Integer.MAX_VALUE);
    }

    /**
     * @return the newest event, if any
     */
    public Optional<TelemetryEvent> latest() {
        lock.readLock().lock();
        try {
            return size == 0 ? Optional.empty() : Optional.of(newestLocked());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return slots.length;
    }

    public String getDeviceId() {
        return deviceId;
    }

    // ---------------------------------------------------------------
    // Internal (caller holds a lock)
    // ---------------------------------------------------------------

    private TelemetryEvent newestLocked() {
        return slots[(cursor - 1 + slots.length) % slots.length];
    }

    private List<TelemetryEvent> copyLast(int n) {
        List<TelemetryEvent> out = new ArrayList<>(n);
        int start = (cursor - n + slots.length) % slots.length;
        for (int i = 0; i < n; i++) {
            out.add(slots[(start + i) % slots.length]);
        }
        return out;
    }

    private List<TelemetryEvent> windowLocked(double seconds, double now) {
        double cutoff = now - seconds;
        List<TelemetryEvent> out = new ArrayList<>();
        int start = (cursor - size + slots.length) % slots.length;
        for (int i = 0; i < size; i++) {
            TelemetryEvent event = slots[(start + i) % slots.length];
            if (event.getTimestamp() >= cutoff) {
                out.add(event);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "DeviceHistory{deviceId='" + deviceId + "', size=" + size() + ", capacity=" + slots.length + '}';
    }
}
