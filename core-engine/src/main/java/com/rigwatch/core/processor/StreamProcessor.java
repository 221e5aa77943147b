package com.rigwatch.core.processor;

import com.rigwatch.core.alert.AlertDispatcher;
import com.rigwatch.core.alert.AlertSink;
import com.rigwatch.core.alert.LoggingAlertSink;
import com.rigwatch.core.analytics.DeviceAnalytics;
import com.rigwatch.core.analytics.FleetAnalytics;
import com.rigwatch.core.analytics.SystemOverview;
import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.detection.Detector;
import com.rigwatch.core.detection.DetectorChain;
import com.rigwatch.core.detection.DetectorFactory;
import com.rigwatch.core.detection.EnsembleDetector;
import com.rigwatch.core.detection.ScoringModel;
import com.rigwatch.core.health.HealthScorer;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.DeviceHistoryStore;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DeviceHealth;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.ProcessorStats;
import com.rigwatch.core.model.TelemetryEvent;
import com.rigwatch.core.trend.TrendAnalyzer;
import com.rigwatch.core.trend.TrendReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-event orchestration: validate, store, detect, vote, dispatch.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Validate the event; rejected events throw {@link InvalidEventException}
 * and are never stored.</li>
 * <li>Append it to the device's {@link DeviceHistory}.</li>
 * <li>Run the detector chain. A failing detector yields a degraded verdict
 * and one processing error; the rest of the chain still runs.</li>
 * <li>Combine the healthy signals with the {@link EnsembleDetector}.</li>
 * <li>Dispatch an alert for every anomalous verdict.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Events of one device are processed one at a time (per-device lock);
 * different devices proceed in parallel. {@link #submit} additionally offers
 * a bounded worker pool striped by device id that preserves per-device
 * arrival order.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * All time-relative queries use event time, so replaying the same stream
 * into a fresh processor yields the same verdicts and alerts.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamProcessor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamProcessor.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 30_000L;

    private final PipelineConfig config;
    private final DeviceHistoryStore histories;
    private final DetectorChain chain;
    private final EnsembleDetector ensemble;
    private final AlertDispatcher dispatcher;
    private final TrendAnalyzer trendAnalyzer;
    private final FleetAnalytics analytics;
    private final StatsRecorder stats;

    private final ConcurrentMap<String, ReentrantLock> deviceLocks = new ConcurrentHashMap<>();
    private final List<ThreadPoolExecutor> stripes;
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // set under the lifecycle write lock once in-flight pipelines have drained
    private volatile boolean stopped;

    private StreamProcessor(Builder builder) {
        this.config = builder.config;
        this.stats = new StatsRecorder(builder.clock);
        this.histories = new DeviceHistoryStore(config.getBufferCapacityPerDevice());
        this.chain = DetectorFactory.createChain(config, builder.scoringModel);
        this.ensemble = DetectorFactory.createEnsemble(config, builder.scoringModel);
        List<AlertSink> sinks = builder.sinks.isEmpty() ? List.of(new LoggingAlertSink()) : builder.sinks;
        this.dispatcher = new AlertDispatcher(config, sinks, stats);
        this.trendAnalyzer = new TrendAnalyzer(config.getSeasonalMaxLag(), config.getMovingAverageWindow());
        this.analytics = new FleetAnalytics(histories, dispatcher, new HealthScorer(config), trendAnalyzer,
                config.getAlertLookbackSeconds());
        this.stripes = createStripes(config.getWorkerStripes(), config.getWorkerQueueCapacity());

        LOG.info("StreamProcessor started: {} detector(s) [{}], {} worker stripe(s)",
                chain.size(), detectorNames(), stripes.size());
    }

    public static Builder builder(PipelineConfig config) {
        return new Builder(config);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Process one event on the calling thread.
     *
     * @param event the event
     * @return verdicts and dispatched alerts
     * @throws InvalidEventException if the event fails validation
     * @throws IllegalStateException after {@link #shutdown(long)}
     */
    public ProcessingResult processEvent(TelemetryEvent event) {
        ensureOpen();
        return runPipeline(event);
    }

    /**
     * @return the chain verdicts followed by the ensemble verdict
     * @see #processEvent(TelemetryEvent)
     */
    public List<AnomalyVerdict> process(TelemetryEvent event) {
        return processEvent(event).verdicts();
    }

    /**
     * Alias of {@link #process(TelemetryEvent)}.
     */
    public List<AnomalyVerdict> ingest(TelemetryEvent event) {
        return process(event);
    }

    /**
     * Queue the event on its device's worker stripe.
     *
     * <p>
     * The returned future fails with {@link InvalidEventException} for
     * invalid events and with {@link RejectedExecutionException} when the
     * stripe's queue is full.
     * </p>
     *
     * @throws IllegalStateException after {@link #shutdown(long)} or when the
     *                               processor has no worker stripes
     */
    public CompletableFuture<List<AnomalyVerdict>> submit(TelemetryEvent event) {
        ensureOpen();
        if (stripes.isEmpty()) {
            throw new IllegalStateException("Worker pool is disabled (workerStripes = 0)");
        }
        try {
            checkValid(event);
        } catch (InvalidEventException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<List<AnomalyVerdict>> result = new CompletableFuture<>();
        ThreadPoolExecutor stripe = stripes.get(Math.floorMod(event.getDeviceId().hashCode(), stripes.size()));
        try {
            stripe.execute(() -> {
                try {
                    result.complete(runPipeline(event).verdicts());
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Worker stripe full, rejecting event for device [{}]", event.getDeviceId());
            result.completeExceptionally(e);
        }
        return result;
    }

    private ProcessingResult runPipeline(TelemetryEvent event) {
        lifecycle.readLock().lock();
        try {
            if (stopped) {
                throw new IllegalStateException("StreamProcessor is shut down");
            }
            checkValid(event);
            String deviceId = event.getDeviceId();
            ReentrantLock lock = deviceLocks.computeIfAbsent(deviceId, k -> new ReentrantLock());
            lock.lock();
            try {
                DeviceHistory history = histories.getOrCreate(deviceId);
                history.append(event);
                dispatcher.observe(event.getTimestamp());

                List<AnomalyVerdict> verdicts = new ArrayList<>(chain.evaluate(event, history, this::onDetectorFailure));
                verdicts.add(ensemble.combine(event, history, verdicts));

                List<Alert> alerts = new ArrayList<>();
                for (AnomalyVerdict verdict : verdicts) {
                    if (verdict.isAnomaly()) {
                        dispatcher.dispatch(event, verdict).ifPresent(alerts::add);
                    }
                }
                stats.onEventProcessed();
                return new ProcessingResult(verdicts, alerts);
            } finally {
                lock.unlock();
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private void onDetectorFailure(Detector detector, TelemetryEvent event, RuntimeException error) {
        stats.onProcessingError();
        ProcessorExecutionException failure =
                new ProcessorExecutionException(detector.getName(), event.getDeviceId(), error);
        LOG.error(failure.getMessage(), failure);
    }

    private void checkValid(TelemetryEvent event) {
        try {
            validate(event);
        } catch (InvalidEventException e) {
            stats.onInvalidEvent();
            LOG.warn("Rejected invalid event: {}", e.getMessage());
            throw e;
        }
    }

    static void validate(TelemetryEvent event) {
        if (event == null) {
            throw new InvalidEventException("Event must not be null");
        }
        if (event.getDeviceId() == null || event.getDeviceId().isBlank()) {
            throw new InvalidEventException("Event device_id must not be blank");
        }
        double ts = event.getTimestamp();
        if (Double.isNaN(ts) || Double.isInfinite(ts) || ts < 0) {
            throw new InvalidEventException("Event timestamp must be a non-negative number, got: " + ts
                    + " (device " + event.getDeviceId() + ")");
        }
        for (Metric metric : Metric.values()) {
            double value = event.valueOf(metric);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidEventException("Event " + metric.key() + " must be finite, got: " + value
                        + " (device " + event.getDeviceId() + ")");
            }
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public DeviceHealth getDeviceHealth(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        return analytics.deviceHealth(deviceId);
    }

    /**
     * @return alerts raised within {@code windowSeconds} of the latest event time
     */
    public List<Alert> getRecentAlerts(double windowSeconds) {
        return dispatcher.recentAlerts(windowSeconds);
    }

    public ProcessorStats getProcessorStats() {
        return stats.snapshot();
    }

    public SystemOverview getSystemOverview() {
        return analytics.systemOverview(stats.snapshot());
    }

    public Optional<DeviceAnalytics> getDeviceAnalytics(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        return analytics.deviceAnalytics(deviceId);
    }

    /**
     * @return linear, seasonal and moving-average trend of the metric, empty
     *         for unknown devices
     */
    public Optional<TrendReport> analyzeTrends(String deviceId, Metric metric) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        return histories.find(deviceId).map(history -> trendAnalyzer.analyze(history, metric));
    }

    /**
     * @see AlertDispatcher#cancel(String)
     */
    public boolean cancelAlert(String alertId) {
        return dispatcher.cancel(alertId);
    }

    /**
     * Wait for in-flight alert deliveries.
     */
    public boolean flush(long timeoutMillis) {
        return dispatcher.flush(timeoutMillis);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Stop accepting events, finish queued and running pipelines, then drain
     * and stop the alert sinks.
     *
     * @return {@code true} if everything finished within the timeout
     */
    public boolean shutdown(long timeoutMillis) {
        if (!closed.compareAndSet(false, true)) {
            return true;
        }
        LOG.info("Shutting down StreamProcessor");
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        boolean drained = true;

        stripes.forEach(ThreadPoolExecutor::shutdown);
        try {
            for (ThreadPoolExecutor stripe : stripes) {
                if (!stripe.awaitTermination(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                    stripe.shutdownNow();
                    drained = false;
                }
            }
            if (lifecycle.writeLock().tryLock(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                try {
                    stopped = true;
                } finally {
                    lifecycle.writeLock().unlock();
                }
            } else {
                drained = false;
            }
        } catch (InterruptedException e) {
            stripes.forEach(ThreadPoolExecutor::shutdownNow);
            Thread.currentThread().interrupt();
            drained = false;
        }
        stopped = true;

        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(remainingNanos(deadline));
        drained &= dispatcher.shutdown(remainingMillis);
        LOG.info("StreamProcessor shut down (drained={}, stats={})", drained, stats.snapshot());
        return drained;
    }

    @Override
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_MILLIS);
    }

    public boolean isShutdown() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("StreamProcessor is shut down");
        }
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private static List<ThreadPoolExecutor> createStripes(int count, int queueCapacity) {
        List<ThreadPoolExecutor> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = "rigwatch-worker-" + i;
            out.add(new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(queueCapacity),
                    r -> {
                        Thread t = new Thread(r, name);
                        t.setDaemon(true);
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy()));
        }
        return out;
    }

    private String detectorNames() {
        List<String> names = new ArrayList<>();
        chain.getDetectors().forEach(d -> names.add(d.getName()));
        return String.join(", ", names);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link StreamProcessor}. Without sinks, alerts go to a
     * {@link LoggingAlertSink}.
     */
    public static final class Builder {
        private final PipelineConfig config;
        private final List<AlertSink> sinks = new ArrayList<>();
        private ScoringModel scoringModel;
        private Clock clock = Clock.systemUTC();

        private Builder(PipelineConfig config) {
            this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        }

        public Builder sink(AlertSink sink) {
            sinks.add(Objects.requireNonNull(sink, "AlertSink must not be null"));
            return this;
        }

        public Builder sinks(List<AlertSink> sinks) {
            sinks.forEach(this::sink);
            return this;
        }

        /**
         * @param scoringModel model for the external-model detector, or
         *                     {@code null} to run without one
         */
        public Builder scoringModel(ScoringModel scoringModel) {
            this.scoringModel = scoringModel;
            return this;
        }

        /**
         * Clock for {@link ProcessorStats#lastProcessed()}.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must not be null");
            return this;
        }

        /**
         * @throws IllegalStateException if the configuration is invalid
         */
        public StreamProcessor build() {
            config.validate();
            return new StreamProcessor(this);
        }
    }
}
