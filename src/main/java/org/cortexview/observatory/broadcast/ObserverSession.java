package org.cortexview.observatory.broadcast;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * One connected observer: its channel, its bounded outbound queue and its send loop.
 * <p>
 * The send loop runs on the shared send executor, at most one instance per session at a
 * time, and drains the queue until it is empty. A blocked write therefore only stalls this
 * session. Payloads older than one already offered are ignored, so delivery order is
 * non-decreasing in snapshot time.
 * <p>
 * Sessions are created and owned by the {@link BroadcastHub}.
 */
public final class ObserverSession {

    private final IObserverChannel channel;
    private final ReplacePendingQueue<SnapshotPayload> queue;
    private final Executor sendExecutor;
    private final BiConsumer<ObserverSession, Exception> onFailure;
    private final Instant connectedAt;

    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong sentCount = new AtomicLong();
    private final Object offerLock = new Object();

    private Instant lastOfferedTimestamp;
    private volatile Instant lastSentTimestamp;
    private volatile boolean writing = false;
    private volatile long writeStartedNanos;

    ObserverSession(final IObserverChannel channel,
                    final int queueDepth,
                    final Executor sendExecutor,
                    final BiConsumer<ObserverSession, Exception> onFailure) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.queue = new ReplacePendingQueue<>(queueDepth);
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor");
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
        this.connectedAt = Instant.now();
    }

    /**
     * Queues a payload for delivery, replacing undelivered older payloads beyond the queue depth.
     *
     * @param payload The payload.
     * @return true if the payload was queued, false if the session is closed or the payload is outdated.
     */
    boolean offer(final SnapshotPayload payload) {
        if (!alive.get()) {
            return false;
        }
        synchronized (offerLock) {
            if (lastOfferedTimestamp != null && payload.timestamp().isBefore(lastOfferedTimestamp)) {
                return false;
            }
            lastOfferedTimestamp = payload.timestamp();
            queue.offer(payload);
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sendExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            if (alive.get()) {
                onFailure.accept(this, e);
            }
        }
    }

    private void drain() {
        try {
            SnapshotPayload next;
            while (alive.get() && (next = queue.poll()) != null) {
                write(next);
            }
        } catch (IOException | RuntimeException e) {
            writing = false;
            if (alive.get()) {
                onFailure.accept(this, e);
            }
            return;
        } finally {
            draining.set(false);
        }
        // An offer may have landed between the last poll and the reset of the draining flag.
        if (alive.get() && !queue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void write(final SnapshotPayload payload) throws IOException {
        writeStartedNanos = System.nanoTime();
        writing = true;
        channel.send(payload.json());
        writing = false;
        lastSentTimestamp = payload.timestamp();
        sentCount.incrementAndGet();
    }

    /**
     * @param nowNanos Current {@link System#nanoTime()}.
     * @param timeoutNanos Maximum duration of a single write.
     * @return true if a write has been in progress for longer than the timeout.
     */
    boolean isWriteStalled(final long nowNanos, final long timeoutNanos) {
        return writing && nowNanos - writeStartedNanos > timeoutNanos;
    }

    /**
     * Marks the session dead, drops pending payloads and closes the channel. Idempotent.
     */
    void close() {
        if (alive.compareAndSet(true, false)) {
            queue.clear();
            channel.close();
        }
    }

    public String id() {
        return channel.id();
    }

    public boolean isAlive() {
        return alive.get();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    /**
     * @return The timestamp of the last snapshot written to the channel, or null if none yet.
     */
    public Instant getLastSentTimestamp() {
        return lastSentTimestamp;
    }

    public long getSentCount() {
        return sentCount.get();
    }

    /**
     * @return Number of payloads currently waiting in the outbound queue.
     */
    public int getPendingCount() {
        return queue.size();
    }

    public int getQueueDepth() {
        return queue.capacity();
    }

    public long getReplacedCount() {
        return queue.replacedCount();
    }
}
