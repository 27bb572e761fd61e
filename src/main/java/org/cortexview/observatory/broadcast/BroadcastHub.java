package org.cortexview.observatory.broadcast;

import org.cortexview.observatory.api.resources.IMonitorable;
import org.cortexview.observatory.api.resources.OperationalError;
import org.cortexview.observatory.json.ObservatoryJson;
import org.cortexview.observatory.snapshot.Snapshot;
import org.cortexview.observatory.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans each snapshot out to every connected observer.
 * <p>
 * The hub exclusively owns the session set. On each tick the snapshot is serialized once and
 * offered to every live session's own bounded queue; the offer never blocks, so a slow or
 * stuck observer cannot delay the others. Sessions whose write fails, or whose write has
 * been in progress longer than the write timeout, are evicted without affecting anyone else.
 * <p>
 * Thread Safety: the session set is guarded by a lock that is only held to mutate or copy
 * the set, never across network I/O.
 */
public class BroadcastHub implements IMonitorable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastHub.class);

    private final SnapshotStore store;
    private final BroadcastSettings settings;
    private final Executor sendExecutor;

    private final Object sessionsLock = new Object();
    private final Map<String, ObserverSession> sessions = new LinkedHashMap<>();

    private volatile SerializedSnapshot latest;

    private final AtomicLong registered = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong broadcasts = new AtomicLong();
    private final AtomicLong outdatedOffers = new AtomicLong();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * @param store        Source of the current snapshot for newly registered sessions.
     * @param settings     Queue depth and write timeout.
     * @param sendExecutor Executor running the per-session send loops. Must not run tasks on the
     *                     calling thread and should not bound its thread count below the number
     *                     of sessions expected to block at the same time.
     */
    public BroadcastHub(final SnapshotStore store, final BroadcastSettings settings, final Executor sendExecutor) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor");
    }

    /**
     * Adds an observer and immediately queues the current snapshot for it, so a new observer
     * never starts from a blank state. A live session with the same id is replaced.
     *
     * @param channel The observer's channel.
     * @return The new session.
     */
    public ObserverSession register(final IObserverChannel channel) {
        final ObserverSession session = new ObserverSession(
            channel, settings.queueDepth(), sendExecutor, this::onSessionFailure);
        final ObserverSession displaced;
        synchronized (sessionsLock) {
            displaced = sessions.put(session.id(), session);
        }
        if (displaced != null) {
            displaced.close();
        }
        registered.incrementAndGet();
        LOGGER.debug("Observer session '{}' registered", session.id());

        currentPayload().ifPresent(session::offer);
        return session;
    }

    /**
     * Removes an observer and closes its channel. Unknown ids are ignored.
     *
     * @param sessionId The session id.
     * @return true if a session was removed.
     */
    public boolean unregister(final String sessionId) {
        final ObserverSession session;
        synchronized (sessionsLock) {
            session = sessions.remove(sessionId);
        }
        if (session == null) {
            return false;
        }
        session.close();
        LOGGER.debug("Observer session '{}' unregistered", sessionId);
        return true;
    }

    /**
     * Delivers a freshly published snapshot to every session. Called once per collector tick.
     *
     * @param snapshot The snapshot just published.
     */
    public void onTick(final Snapshot snapshot) {
        final SnapshotPayload payload = new SnapshotPayload(snapshot.timestamp(), ObservatoryJson.write(snapshot));
        latest = new SerializedSnapshot(snapshot, payload);

        final long now = System.nanoTime();
        final long writeTimeoutNanos = settings.writeTimeout().toNanos();
        for (final ObserverSession session : liveSessions()) {
            if (session.isWriteStalled(now, writeTimeoutNanos)) {
                evict(session, "write exceeded " + settings.writeTimeout().toMillis() + " ms");
                continue;
            }
            if (!session.offer(payload) && session.isAlive()) {
                outdatedOffers.incrementAndGet();
            }
        }
        broadcasts.incrementAndGet();
    }

    /**
     * Closes every session. Used on shutdown.
     */
    public void closeAll() {
        final List<ObserverSession> all;
        synchronized (sessionsLock) {
            all = new ArrayList<>(sessions.values());
            sessions.clear();
        }
        all.forEach(ObserverSession::close);
        if (!all.isEmpty()) {
            LOGGER.info("Closed {} observer session(s)", all.size());
        }
    }

    public BroadcastSettings getSettings() {
        return settings;
    }

    public int getSessionCount() {
        synchronized (sessionsLock) {
            return sessions.size();
        }
    }

    public Optional<ObserverSession> getSession(final String sessionId) {
        synchronized (sessionsLock) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    private List<ObserverSession> liveSessions() {
        synchronized (sessionsLock) {
            return new ArrayList<>(sessions.values());
        }
    }

    private Optional<SnapshotPayload> currentPayload() {
        final Optional<Snapshot> current = store.current();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        final SerializedSnapshot cached = latest;
        if (cached != null && cached.source() == current.get()) {
            return Optional.of(cached.payload());
        }
        return Optional.of(new SnapshotPayload(current.get().timestamp(), ObservatoryJson.write(current.get())));
    }

    private void onSessionFailure(final ObserverSession session, final Exception cause) {
        evict(session, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private void evict(final ObserverSession session, final String reason) {
        final boolean removed;
        synchronized (sessionsLock) {
            removed = sessions.remove(session.id(), session);
        }
        session.close();
        if (removed) {
            evicted.incrementAndGet();
            errors.add(new OperationalError(Instant.now(), "SESSION_WRITE_FAILURE", "Observer session evicted", session.id() + ": " + reason));
            while (errors.size() > 1000) {
                errors.pollFirst();
            }
            LOGGER.info("Evicted observer session '{}': {}", session.id(), reason);
        }
    }

    @Override
    public Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        long replaced = 0;
        final List<ObserverSession> all = liveSessions();
        for (final ObserverSession session : all) {
            replaced += session.getReplacedCount();
        }
        metrics.put("sessions", all.size());
        metrics.put("sessions_registered", registered.get());
        metrics.put("sessions_evicted", evicted.get());
        metrics.put("broadcasts", broadcasts.get());
        metrics.put("payloads_replaced", replaced);
        metrics.put("outdated_offers", outdatedOffers.get());
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

    /**
     * Evicted sessions are routine (observers disconnect), so the hub always reports healthy.
     */
    @Override
    public boolean isHealthy() {
        return true;
    }

    private record SerializedSnapshot(Snapshot source, SnapshotPayload payload) {
    }
}
