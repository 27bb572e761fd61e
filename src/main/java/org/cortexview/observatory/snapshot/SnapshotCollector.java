package org.cortexview.observatory.snapshot;

import org.cortexview.observatory.api.resources.IMonitorable;
import org.cortexview.observatory.api.resources.OperationalError;
import org.cortexview.observatory.api.stores.IStreamStoreReader;
import org.cortexview.observatory.api.stores.IVectorStoreReader;
import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.cortexview.observatory.api.stores.StreamRecord;
import org.cortexview.observatory.api.stores.StreamWindow;
import org.cortexview.observatory.api.stores.VectorRecord;
import org.cortexview.observatory.snapshot.SourceReadings.MemoryReading;
import org.cortexview.observatory.snapshot.SourceReadings.StreamReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples the thought stream and the memory store once per tick and publishes one new
 * {@link Snapshot} to the {@link SnapshotStore}.
 * <p>
 * Both sources are read concurrently, each bounded by the configured source timeout. A source
 * that fails or times out contributes its last good reading and is marked stale; the tick is
 * never skipped. Derived fields are recomputed from whatever readings are used. The uptime is
 * taken from the clock and keeps advancing while sources are down.
 * <p>
 * Thread Safety: {@link #tick()} is serialized; metrics can be read from any thread.
 */
public class SnapshotCollector implements IMonitorable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCollector.class);

    public static final String STREAM_SOURCE = "stream";
    public static final String MEMORY_SOURCE = "memory";

    private final IStreamStoreReader streamReader;
    private final IVectorStoreReader memoryReader;
    private final SnapshotStore store;
    private final CollectorSettings settings;
    private final ExecutorService readerPool;
    private final Clock clock;
    private final Instant startedAt;
    private final ThoughtParser parser = new ThoughtParser();

    private final SourceTracker<StreamReading> stream = new SourceTracker<>(STREAM_SOURCE, StreamReading.EMPTY);
    private final SourceTracker<MemoryReading> memory = new SourceTracker<>(MEMORY_SOURCE, MemoryReading.EMPTY);

    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong malformedThoughts = new AtomicLong();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    // Malformed entry ids in the previous window; each is counted only when it first appears.
    private volatile Set<String> malformedInWindow = Set.of();

    /**
     * @param streamReader The thought stream.
     * @param memoryReader The memory store.
     * @param store        Where snapshots are published.
     * @param settings     Collector settings.
     * @param readerPool   Pool running the source reads; must allow two concurrent reads.
     * @param clock        Clock for timestamps and uptime.
     */
    public SnapshotCollector(final IStreamStoreReader streamReader,
                             final IVectorStoreReader memoryReader,
                             final SnapshotStore store,
                             final CollectorSettings settings,
                             final ExecutorService readerPool,
                             final Clock clock) {
        this.streamReader = Objects.requireNonNull(streamReader, "streamReader");
        this.memoryReader = Objects.requireNonNull(memoryReader, "memoryReader");
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.readerPool = Objects.requireNonNull(readerPool, "readerPool");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    /**
     * Runs one collection tick and publishes its snapshot.
     *
     * @return The published snapshot.
     */
    public synchronized Snapshot tick() {
        stream.begin(readerPool, this::readStream);
        memory.begin(readerPool, this::readMemory);

        final long deadline = System.nanoTime() + settings.sourceTimeout().toNanos();
        final StreamReading streamReading = stream.await(deadline);
        final MemoryReading memoryReading = memory.await(deadline);

        final Snapshot snapshot = assemble(streamReading, memoryReading);
        store.publish(snapshot);
        ticks.incrementAndGet();
        return snapshot;
    }

    private Snapshot assemble(final StreamReading streamReading, final MemoryReading memoryReading) {
        Instant now = clock.instant();
        final Optional<Snapshot> previous = store.current();
        if (previous.isPresent() && now.isBefore(previous.get().timestamp())) {
            now = previous.get().timestamp();
        }
        final long uptime = Math.max(0L, Duration.between(startedAt, now).getSeconds());

        final Snapshot.Identity identity = new Snapshot.Identity(
            settings.identityName(),
            uptime,
            memoryReading.lifetimeThoughts(),
            streamReading.streamLength(),
            memoryReading.restartCount());

        final Snapshot.Cognitive cognitive = new Snapshot.Cognitive(
            memoryReading.consciousMemories(),
            memoryReading.unconsciousMemories(),
            memoryReading.lifetimeDreams(),
            streamReading.streamLength());

        final Map<String, Snapshot.ActorStatus> actors = new LinkedHashMap<>();
        for (final String actor : settings.knownActors()) {
            actors.put(actor, memoryReading.reportedActors().getOrDefault(actor, Snapshot.ActorStatus.MISSING));
        }

        final List<Snapshot.ThoughtSummary> recent = new ArrayList<>(streamReading.thoughts().size());
        for (final ParsedThought thought : streamReading.thoughts()) {
            recent.add(thought.summary());
        }

        return new Snapshot(now, identity, cognitive, EmotionalModel.derive(streamReading.thoughts()), actors, recent);
    }

    private StreamReading readStream() throws SourceUnavailableException {
        final StreamWindow window = streamReader.readLatest(settings.thoughtWindow());
        final List<ParsedThought> thoughts = new ArrayList<>(window.entries().size());
        final Set<String> malformed = new HashSet<>();
        for (final StreamRecord record : window.entries()) {
            final Optional<ParsedThought> parsed = parser.parse(record);
            if (parsed.isPresent()) {
                thoughts.add(parsed.get());
                continue;
            }
            malformed.add(record.id());
            if (!malformedInWindow.contains(record.id())) {
                malformedThoughts.incrementAndGet();
                recordError("MALFORMED_SAMPLE", "Dropped thought entry without content", record.id());
                LOGGER.debug("Dropped malformed thought entry '{}'", record.id());
            }
        }
        malformedInWindow = malformed;
        return new StreamReading(window.length(), thoughts);
    }

    private MemoryReading readMemory() throws SourceUnavailableException {
        final Optional<VectorRecord> identity = memoryReader.retrieve(settings.identityCollection(), settings.identityPointId());
        final long conscious = memoryReader.countPoints(settings.consciousCollection());
        final long unconscious = memoryReader.countPoints(settings.unconsciousCollection());

        if (identity.isEmpty()) {
            return new MemoryReading(0L, 0, 0L, conscious, unconscious, Map.of());
        }
        final VectorRecord point = identity.get();
        return new MemoryReading(
            (long) point.payloadDouble("lifetime_thought_count", 0),
            (int) point.payloadDouble("restart_count", 0),
            (long) point.payloadDouble("lifetime_dream_count", 0),
            conscious,
            unconscious,
            readActors(point.payload().get("actors")));
    }

    /**
     * Reads {@code {"MemoryActor": {"alive": true, "restart_count": 0}, ...}}. Entries that do not
     * have this shape are ignored, which reports the actor as not alive.
     */
    private static Map<String, Snapshot.ActorStatus> readActors(final Object actorsPayload) {
        if (!(actorsPayload instanceof Map)) {
            return Map.of();
        }
        final Map<String, Snapshot.ActorStatus> actors = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : ((Map<?, ?>) actorsPayload).entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            final Map<?, ?> status = (Map<?, ?>) entry.getValue();
            final Object alive = status.get("alive");
            final Object restarts = status.get("restart_count");
            actors.put(String.valueOf(entry.getKey()), new Snapshot.ActorStatus(
                Boolean.TRUE.equals(alive),
                restarts instanceof Number ? ((Number) restarts).intValue() : 0));
        }
        return actors;
    }

    private void recordError(final String code, final String message, final String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > 1000) {
            errors.pollFirst();
        }
    }

    /**
     * @param source {@link #STREAM_SOURCE} or {@link #MEMORY_SOURCE}.
     * @return Whether the source contributed a stale reading to the latest snapshot.
     */
    public boolean isStale(final String source) {
        if (STREAM_SOURCE.equals(source)) {
            return stream.isStale();
        }
        if (MEMORY_SOURCE.equals(source)) {
            return memory.isStale();
        }
        throw new IllegalArgumentException("Unknown source: " + source);
    }

    public CollectorSettings getSettings() {
        return settings;
    }

    @Override
    public Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("ticks", ticks.get());
        metrics.put("malformed_thoughts", malformedThoughts.get());
        for (final SourceTracker<?> tracker : List.of(stream, memory)) {
            metrics.put(tracker.name() + "_stale", tracker.isStale() ? 1 : 0);
            metrics.put(tracker.name() + "_consecutive_failures", tracker.consecutiveFailures());
            metrics.put(tracker.name() + "_failures", tracker.totalFailures());
        }
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return !stream.isStale() && !memory.isStale();
    }
}
