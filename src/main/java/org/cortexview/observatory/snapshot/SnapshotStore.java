package org.cortexview.observatory.snapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the latest {@link Snapshot}.
 * <p>
 * Single writer (the collector), any number of readers. Publishing is a single reference
 * swap, so readers never block the writer and never observe a partially built snapshot.
 * No history is kept.
 */
public final class SnapshotStore {

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final AtomicLong publishCount = new AtomicLong();

    /**
     * Replaces the current snapshot. Last write wins.
     *
     * @param snapshot The new snapshot, never null.
     */
    public void publish(final Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        current.set(snapshot);
        publishCount.incrementAndGet();
    }

    /**
     * @return The latest published snapshot, or empty if nothing has been published yet.
     */
    public Optional<Snapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isInitialized() {
        return current.get() != null;
    }

    public long getPublishCount() {
        return publishCount.get();
    }
}
