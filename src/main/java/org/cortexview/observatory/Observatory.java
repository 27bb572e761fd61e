package org.cortexview.observatory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.cortexview.observatory.api.resources.IMonitorable;
import org.cortexview.observatory.api.stores.IStreamStoreReader;
import org.cortexview.observatory.api.stores.IVectorStoreReader;
import org.cortexview.observatory.broadcast.BroadcastHub;
import org.cortexview.observatory.broadcast.BroadcastSettings;
import org.cortexview.observatory.projection.ProjectionEngine;
import org.cortexview.observatory.projection.ProjectionSettings;
import org.cortexview.observatory.resources.AbstractStoreResource;
import org.cortexview.observatory.resources.QdrantVectorStore;
import org.cortexview.observatory.resources.RedisStreamStore;
import org.cortexview.observatory.snapshot.CollectorSettings;
import org.cortexview.observatory.snapshot.Snapshot;
import org.cortexview.observatory.snapshot.SnapshotCollector;
import org.cortexview.observatory.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the observation pipeline together and drives it.
 * <p>
 * One scheduled thread runs the collector tick at a fixed rate and hands every published
 * snapshot to the broadcast hub in the same tick. A second scheduled thread refreshes the point
 * cloud with a fixed delay. Source reads and observer writes run on their own pools.
 * <p>
 * Configuration (all blocks optional):
 * <pre>
 * tickIntervalMs = 200
 * stream { url, key, timeoutMs }
 * vectors { url, timeoutMs, apiKey, vectorName }
 * collector { ... }      # see CollectorSettings; sourceTimeoutMs defaults to 3/4 of the tick
 * broadcast { ... }      # see BroadcastSettings; writeTimeoutMs defaults to 3/4 of the tick
 * projection {           # see ProjectionSettings
 *   storeTimeoutMs = 1000
 * }
 * </pre>
 */
public class Observatory implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Observatory.class);

    private final Duration tickInterval;
    private final Clock clock;
    private final SnapshotStore snapshotStore;
    private final SnapshotCollector collector;
    private final BroadcastHub hub;
    private final ProjectionEngine projectionEngine;
    private final Map<String, IMonitorable> monitorables = new LinkedHashMap<>();
    private final List<AutoCloseable> ownedResources = new ArrayList<>();

    private final ExecutorService readerPool;
    private final ExecutorService sendPool;
    private final ScheduledExecutorService tickScheduler;
    private final ScheduledExecutorService refreshScheduler;

    private final Instant createdAt;
    private volatile boolean running = false;

    /**
     * Creates the pipeline on the given stores.
     *
     * @param streamStore       The thought stream.
     * @param memoryStore       The vector store as read by the collector.
     * @param projectionStore   The vector store as read by the projection engine.
     * @param tickInterval      Collector tick interval.
     * @param collectorSettings Collector settings.
     * @param broadcastSettings Broadcast settings.
     * @param projectionSettings Projection settings.
     * @param clock             Clock for snapshot timestamps, uptime and point ages.
     * @throws IllegalArgumentException if the timeouts do not fit into the tick interval.
     */
    public Observatory(final IStreamStoreReader streamStore,
                       final IVectorStoreReader memoryStore,
                       final IVectorStoreReader projectionStore,
                       final Duration tickInterval,
                       final CollectorSettings collectorSettings,
                       final BroadcastSettings broadcastSettings,
                       final ProjectionSettings projectionSettings,
                       final Clock clock) {
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        validateTimings(tickInterval, collectorSettings, broadcastSettings);

        this.readerPool = Executors.newCachedThreadPool(namedDaemonThreads("source-reader"));
        this.sendPool = Executors.newCachedThreadPool(namedDaemonThreads("observer-send"));
        this.tickScheduler = Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("collector-tick"));
        this.refreshScheduler = Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("projection-refresh"));

        this.snapshotStore = new SnapshotStore();
        this.collector = new SnapshotCollector(streamStore, memoryStore, snapshotStore, collectorSettings, readerPool, clock);
        this.hub = new BroadcastHub(snapshotStore, broadcastSettings, sendPool);
        this.projectionEngine = new ProjectionEngine(projectionStore, projectionSettings, clock);
        this.createdAt = clock.instant();

        monitorables.put("collector", collector);
        monitorables.put("broadcast", hub);
        monitorables.put("projection", projectionEngine);
        for (final Object store : List.of(streamStore, memoryStore, projectionStore)) {
            if (store instanceof IMonitorable && !monitorables.containsValue(store)) {
                monitorables.put(storeName(store), (IMonitorable) store);
            }
            if (store instanceof AutoCloseable && !ownedResources.contains(store)) {
                ownedResources.add((AutoCloseable) store);
            }
        }
    }

    /**
     * Builds the pipeline, including the Redis and Qdrant clients, from configuration.
     *
     * @param options The observatory options.
     * @return The pipeline, not yet started.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public static Observatory fromConfig(final Config options) {
        final Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "tickIntervalMs", 200,
            "projection.storeTimeoutMs", 1000
        )));
        final Duration tickInterval;
        final CollectorSettings collectorSettings;
        final BroadcastSettings broadcastSettings;
        final ProjectionSettings projectionSettings;
        final long projectionTimeoutMs;
        try {
            tickInterval = Duration.ofMillis(config.getLong("tickIntervalMs"));
            if (tickInterval.isNegative() || tickInterval.isZero()) {
                throw new IllegalArgumentException("tickIntervalMs must be positive, got " + tickInterval.toMillis());
            }
            final long derivedTimeoutMs = Math.max(1L, tickInterval.toMillis() * 3 / 4);
            collectorSettings = CollectorSettings.fromConfig(
                withDefault(block(config, "collector"), "sourceTimeoutMs", derivedTimeoutMs));
            broadcastSettings = BroadcastSettings.fromConfig(
                withDefault(block(config, "broadcast"), "writeTimeoutMs", derivedTimeoutMs));
            projectionSettings = ProjectionSettings.fromConfig(block(config, "projection"));
            projectionTimeoutMs = config.getLong("projection.storeTimeoutMs");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid observatory configuration: " + e.getMessage(), e);
        }
        validateTimings(tickInterval, collectorSettings, broadcastSettings);
        if (projectionTimeoutMs <= 0 || projectionTimeoutMs >= projectionSettings.refreshInterval().toMillis()) {
            throw new IllegalArgumentException("projection.storeTimeoutMs must be positive and less than refreshIntervalMs ("
                + projectionSettings.refreshInterval().toMillis() + "), got " + projectionTimeoutMs);
        }

        // Store clients time out with the collector unless configured otherwise.
        final long sourceTimeoutMs = collectorSettings.sourceTimeout().toMillis();
        final Config streamOptions = withDefault(block(config, "stream"), "timeoutMs", sourceTimeoutMs);
        final Config vectorOptions = block(config, "vectors");

        final RedisStreamStore streamStore = new RedisStreamStore("stream", streamOptions);
        final QdrantVectorStore memoryStore = new QdrantVectorStore("memory", withDefault(vectorOptions, "timeoutMs", sourceTimeoutMs));
        final QdrantVectorStore projectionStore = new QdrantVectorStore("vectors",
            vectorOptions.withValue("timeoutMs", ConfigValueFactory.fromAnyRef(projectionTimeoutMs)));
        LOGGER.debug("Reading stream key '{}' and vector store at '{}'", streamStore.getStreamKey(), memoryStore.getBaseUri());

        return new Observatory(streamStore, memoryStore, projectionStore, tickInterval,
            collectorSettings, broadcastSettings, projectionSettings, Clock.systemUTC());
    }

    private static Config withDefault(final Config options, final String key, final long value) {
        return options.hasPath(key) ? options : options.withValue(key, ConfigValueFactory.fromAnyRef(value));
    }

    private static Config block(final Config config, final String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    private static void validateTimings(final Duration tickInterval,
                                        final CollectorSettings collectorSettings,
                                        final BroadcastSettings broadcastSettings) {
        if (collectorSettings.sourceTimeout().compareTo(tickInterval) >= 0) {
            throw new IllegalArgumentException("collector.sourceTimeoutMs (" + collectorSettings.sourceTimeout().toMillis()
                + ") must be less than tickIntervalMs (" + tickInterval.toMillis() + ")");
        }
        if (broadcastSettings.writeTimeout().compareTo(tickInterval) >= 0) {
            throw new IllegalArgumentException("broadcast.writeTimeoutMs (" + broadcastSettings.writeTimeout().toMillis()
                + ") must be less than tickIntervalMs (" + tickInterval.toMillis() + ")");
        }
    }

    private static String storeName(final Object store) {
        if (store instanceof AbstractStoreResource) {
            return "store_" + ((AbstractStoreResource) store).getResourceName();
        }
        return "store_" + store.getClass().getSimpleName();
    }

    private static ThreadFactory namedDaemonThreads(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Starts the collector tick and the projection refresh. The first tick and the first
     * refresh run immediately.
     */
    public synchronized void start() {
        if (running) {
            LOGGER.debug("Observatory already running");
            return;
        }
        running = true;
        tickScheduler.scheduleAtFixedRate(this::runTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        refreshScheduler.scheduleWithFixedDelay(this::runRefresh, 0,
            projectionEngine.getSettings().refreshInterval().toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Observatory started: tick every {} ms, point cloud refresh every {} ms",
            tickInterval.toMillis(), projectionEngine.getSettings().refreshInterval().toMillis());
    }

    /**
     * Runs one collector tick and broadcasts its snapshot. A runtime failure is logged and the
     * schedule continues.
     */
    void runTick() {
        try {
            final Snapshot snapshot = collector.tick();
            hub.onTick(snapshot);
        } catch (RuntimeException e) {
            LOGGER.error("Collector tick failed", e);
        }
    }

    void runRefresh() {
        try {
            projectionEngine.refresh();
        } catch (RuntimeException e) {
            LOGGER.error("Point cloud refresh failed", e);
        }
    }

    /**
     * Stops scheduling, closes all observer sessions and releases the store clients.
     */
    public synchronized void stop() {
        if (!running) {
            shutdownExecutors();
            closeResources();
            return;
        }
        running = false;
        shutdownExecutors();
        hub.closeAll();
        closeResources();
        LOGGER.info("Observatory stopped");
    }

    private void shutdownExecutors() {
        for (final ExecutorService executor : List.of(tickScheduler, refreshScheduler, readerPool, sendPool)) {
            executor.shutdown();
        }
        for (final ExecutorService executor : List.of(tickScheduler, refreshScheduler, readerPool, sendPool)) {
            try {
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void closeResources() {
        for (final AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                LOGGER.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
        ownedResources.clear();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }

    public SnapshotCollector getCollector() {
        return collector;
    }

    public BroadcastHub getHub() {
        return hub;
    }

    public ProjectionEngine getProjectionEngine() {
        return projectionEngine;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    /**
     * @return Seconds since this pipeline was created, taken from its clock.
     */
    public long getUptimeSeconds() {
        return Math.max(0L, Duration.between(createdAt, clock.instant()).getSeconds());
    }

    /**
     * @return All monitorable components by name, in a stable order.
     */
    public Map<String, IMonitorable> getMonitorables() {
        return Collections.unmodifiableMap(monitorables);
    }
}
