package com.rigwatch.core.alert;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DedupKey;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAccumulator;

/**
 * Turns positive verdicts into alerts, deduplicates them and fans them out
 * to every registered {@link AlertSink}.
 *
 * <h3>Deduplication</h3>
 * <p>
 * At most one alert per (device, alert type) is dispatched within
 * {@code dedupWindowSeconds} of event time; see {@link AlertDeduplicator}.
 * Suppressed alerts are counted through {@link DispatchMetrics}.
 * </p>
 *
 * <h3>Delivery</h3>
 * <p>
 * Each sink receives the alert on a bounded thread pool and gets
 * {@code sinkTimeoutMillis} to answer. Exceptions, {@code false} answers,
 * timeouts and pool rejections are reported as {@link SinkDeliveryException}s
 * and never reach the caller or the other sinks. {@link #dispatch} returns
 * without waiting for delivery; {@link #flush} waits for it.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * The newest {@code alertHistoryCapacity} dispatched alerts are retained for
 * {@link #recentAlerts(double)} and {@link #cancel(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<AlertSink> sinks;
    private final DispatchMetrics metrics;
    private final AlertDeduplicator deduplicator;
    private final long dedupWindowSeconds;
    private final long sinkTimeoutMillis;
    private final int historyCapacity;
    private final ThreadPoolExecutor sinkPool;

    private final Deque<Alert> retained = new ArrayDeque<>();
    private final Map<String, Alert> retainedById = new HashMap<>();
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final DoubleAccumulator streamTime = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param config  pipeline configuration
     * @param sinks   delivery channels, in registration order
     * @param metrics counters to report to
     */
    public AlertDispatcher(PipelineConfig config, List<AlertSink> sinks, DispatchMetrics metrics) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        Objects.requireNonNull(sinks, "Sinks must not be null");
        this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
        this.metrics = Objects.requireNonNull(metrics, "DispatchMetrics must not be null");
        this.dedupWindowSeconds = config.getDedupWindowSeconds();
        this.deduplicator = new AlertDeduplicator(dedupWindowSeconds);
        this.sinkTimeoutMillis = config.getSinkTimeoutMillis();
        this.historyCapacity = config.getAlertHistoryCapacity();
        this.sinkPool = new ThreadPoolExecutor(
                config.getSinkThreads(), config.getSinkThreads(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.getSinkQueueCapacity()),
                new SinkThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
        LOG.info("AlertDispatcher started with {} sink(s): {}", this.sinks.size(), sinkNames());
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    /**
     * Build, deduplicate and fan out the alert for a positive verdict.
     *
     * @param event   the triggering event
     * @param verdict an anomalous verdict
     * @return the dispatched alert, or empty if it was suppressed
     * @throws IllegalArgumentException if the verdict is not an anomaly
     * @throws IllegalStateException    after {@link #shutdown(long)}
     */
    public Optional<Alert> dispatch(TelemetryEvent event, AnomalyVerdict verdict) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(verdict, "Verdict must not be null");
        if (!verdict.isAnomaly()) {
            throw new IllegalArgumentException("Only anomalous verdicts are dispatched, got: " + verdict);
        }
        if (closed.get()) {
            throw new IllegalStateException("AlertDispatcher is shut down");
        }
        observe(event.getTimestamp());

        String deviceId = event.getDeviceId();
        String alertType = verdict.getAlertType();
        if (!deduplicator.tryAcquire(deviceId, alertType, event.getTimestamp())) {
            metrics.onDuplicateSuppressed();
            LOG.debug("Suppressed duplicate alert {} for device [{}] at {}", alertType, deviceId, event.getTimestamp());
            return Optional.empty();
        }

        Alert alert = Alert.builder()
                .deviceId(deviceId)
                .alertType(alertType)
                .severity(verdict.getSeverity())
                .timestamp(event.getTimestamp())
                .payload(payload(event, verdict))
                .dedupKey(DedupKey.of(deviceId, alertType, event.getTimestamp(), dedupWindowSeconds))
                .build();

        retain(alert);
        metrics.onAlertDispatched();
        LOG.info("Dispatching {} alert {} for device [{}] (severity={}, detector={})",
                alertType, alert.getId(), deviceId, alert.getSeverity(), verdict.getDetector());

        fanOut(alert);
        return Optional.of(alert);
    }

    private static Map<String, Object> payload(TelemetryEvent event, AnomalyVerdict verdict) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("detector", verdict.getDetector());
        payload.put("method", verdict.getMethod().name());
        payload.put("score", verdict.getScore());
        payload.put("reasons", verdict.getReasons());
        payload.put("temperature", event.getTemperature());
        payload.put("pressure", event.getPressure());
        payload.put("status", event.getStatus());
        if (!verdict.getDetails().isEmpty()) {
            payload.put("details", verdict.getDetails());
        }
        return payload;
    }

    private void fanOut(Alert alert) {
        for (AlertSink sink : sinks) {
            CompletableFuture<Boolean> send;
            try {
                send = CompletableFuture.supplyAsync(() -> sink.send(alert), sinkPool);
            } catch (RejectedExecutionException e) {
                fail(new SinkDeliveryException(sink.getName(), alert.getId(), "sink pool is full", e));
                continue;
            }
            CompletableFuture<Void> delivery = send
                    .orTimeout(sinkTimeoutMillis, TimeUnit.MILLISECONDS)
                    .handle((delivered, error) -> {
                        if (error != null) {
                            Throwable cause = error.getCause() != null ? error.getCause() : error;
                            String reason = cause instanceof TimeoutException
                                    ? "timed out after " + sinkTimeoutMillis + " ms"
                                    : cause.toString();
                            fail(new SinkDeliveryException(sink.getName(), alert.getId(), reason, cause));
                        } else if (!Boolean.TRUE.equals(delivered)) {
                            fail(new SinkDeliveryException(sink.getName(), alert.getId(), "sink returned false", null));
                        }
                        return null;
                    });
            inFlight.add(delivery);
            delivery.whenComplete((ignored, error) -> inFlight.remove(delivery));
        }
    }

    private void fail(SinkDeliveryException failure) {
        LOG.warn(failure.getMessage());
        metrics.onSinkFailure(failure);
    }

    // ---------------------------------------------------------------
    // Retention / queries
    // ---------------------------------------------------------------

    private synchronized void retain(Alert alert) {
        retained.addLast(alert);
        retainedById.put(alert.getId(), alert);
        while (retained.size() > historyCapacity) {
            Alert evicted = retained.removeFirst();
            retainedById.remove(evicted.getId());
        }
    }

    /**
     * Advance stream time. Called for every accepted event so that queries
     * relative to "now" follow event time.
     */
    public void observe(double eventTime) {
        streamTime.accumulate(eventTime);
    }

    /**
     * @return newest event time seen, or {@code NaN} before the first event
     */
    public double streamTime() {
        double t = streamTime.get();
        return t == Double.NEGATIVE_INFINITY ? Double.NaN : t;
    }

    /**
     * Retained alerts raised within {@code windowSeconds} of the latest
     * stream time, oldest first.
     */
    public List<Alert> recentAlerts(double windowSeconds) {
        double now = streamTime();
        return Double.isNaN(now) ? Collections.emptyList() : recentAlerts(windowSeconds, now);
    }

    /**
     * Retained alerts with {@code timestamp >= now - windowSeconds}, oldest first.
     */
    public synchronized List<Alert> recentAlerts(double windowSeconds, double now) {
        double cutoff = now - windowSeconds;
        List<Alert> out = new ArrayList<>();
        for (Alert alert : retained) {
            if (alert.getTimestamp() >= cutoff) {
                out.add(alert);
            }
        }
        return out;
    }

    /**
     * Retained alerts of one device within {@code windowSeconds} of {@code now}.
     */
    public List<Alert> recentAlerts(String deviceId, double windowSeconds, double now) {
        List<Alert> out = new ArrayList<>();
        for (Alert alert : recentAlerts(windowSeconds, now)) {
            if (alert.getDeviceId().equals(deviceId)) {
                out.add(alert);
            }
        }
        return out;
    }

    /**
     * Cancel an alert: further alerts of the same device and type are
     * suppressed for one more dedup window from the latest stream time. The
     * alert itself is not modified.
     *
     * @param alertId id of a retained alert
     * @return {@code true} if the alert was found
     */
    public boolean cancel(String alertId) {
        Alert alert;
        synchronized (this) {
            alert = retainedById.get(alertId);
        }
        if (alert == null) {
            LOG.warn("Cannot cancel unknown alert {}", alertId);
            return false;
        }
        double from = Math.max(alert.getTimestamp(), streamTime());
        deduplicator.suppress(alert.getDeviceId(), alert.getAlertType(), from + dedupWindowSeconds);
        LOG.info("Cancelled alert {} ({} for device [{}])", alertId, alert.getAlertType(), alert.getDeviceId());
        return true;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Wait for every in-flight delivery.
     *
     * @return {@code true} if all deliveries finished within the timeout
     */
    public boolean flush(long timeoutMillis) {
        CompletableFuture<?>[] pending = inFlight.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeoutMillis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            LOG.warn("{} alert deliveries still in flight after {} ms", inFlight.size(), timeoutMillis);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Alert delivery failed unexpectedly", e.getCause());
        }
    }

    /**
     * Stop accepting alerts, drain in-flight deliveries and release the sink
     * pool.
     *
     * @return {@code true} if everything drained within the timeout
     */
    public boolean shutdown(long timeoutMillis) {
        if (!closed.compareAndSet(false, true)) {
            return true;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        boolean drained = flush(timeoutMillis);
        sinkPool.shutdown();
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!sinkPool.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                LOG.warn("Sink pool did not terminate in time; interrupting");
                sinkPool.shutdownNow();
                drained = false;
            }
        } catch (InterruptedException e) {
            sinkPool.shutdownNow();
            Thread.currentThread().interrupt();
            drained = false;
        }
        LOG.info("AlertDispatcher shut down (drained={})", drained);
        return drained;
    }

    @Override
    public void close() {
        shutdown(sinkTimeoutMillis);
    }

    public boolean isShutdown() {
        return closed.get();
    }

    public List<AlertSink> getSinks() {
        return sinks;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private List<String> sinkNames() {
        List<String> names = new ArrayList<>(sinks.size());
        sinks.forEach(s -> names.add(s.getName()));
        return names;
    }

    private static final class SinkThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rigwatch-sink-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
