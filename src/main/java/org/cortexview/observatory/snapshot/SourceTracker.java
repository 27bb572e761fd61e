package org.cortexview.observatory.snapshot;

import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks one source of the collector: its last good reading, the read in flight and whether
 * the source is stale.
 * <p>
 * A read that outlives its tick is left to finish on its own (the store client's socket
 * timeout bounds it); while it is still running the source is not queried again and counts as
 * unavailable. If it finishes successfully, its reading is adopted when the next read begins.
 * Only the collector thread calls {@link #begin} and {@link #await}.
 *
 * @param <T> The reading type.
 */
final class SourceTracker<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceTracker.class);

    private final String name;
    private final AtomicLong totalFailures = new AtomicLong();
    private volatile T lastGood;
    private volatile boolean stale = false;
    private volatile int consecutiveFailures = 0;
    private Future<T> inFlight;
    private boolean consumed = true;
    private boolean startedThisTick;

    SourceTracker(final String name, final T initial) {
        this.name = name;
        this.lastGood = initial;
    }

    /**
     * Starts this tick's read unless the previous one is still running.
     */
    void begin(final ExecutorService pool, final Callable<T> read) {
        if (inFlight != null && !inFlight.isDone()) {
            startedThisTick = false;
            return;
        }
        adoptLateReading();
        inFlight = pool.submit(read);
        consumed = false;
        startedThisTick = true;
    }

    private void adoptLateReading() {
        if (inFlight == null || consumed) {
            return;
        }
        consumed = true;
        try {
            succeed(inFlight.get());
        } catch (ExecutionException e) {
            LOGGER.debug("Late read of source '{}' failed: {}", name, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for this tick's read until the deadline and returns the reading to use, which is
     * the last good one if the read failed, timed out or was not started.
     *
     * @param deadlineNanos Deadline on the {@link System#nanoTime()} scale.
     */
    T await(final long deadlineNanos) {
        if (!startedThisTick) {
            fail("previous read still in progress");
            return lastGood;
        }
        try {
            final long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            final T reading = inFlight.get(remaining, TimeUnit.NANOSECONDS);
            consumed = true;
            succeed(reading);
        } catch (TimeoutException e) {
            fail("read timed out");
        } catch (ExecutionException e) {
            consumed = true;
            final Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException) {
                fail(cause.getMessage());
            } else {
                LOGGER.debug("Unexpected failure reading source '{}'", name, cause);
                fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrupted");
        }
        return lastGood;
    }

    private void succeed(final T reading) {
        lastGood = reading;
        if (stale) {
            LOGGER.info("Source '{}' recovered after {} failed tick(s)", name, consecutiveFailures);
        }
        stale = false;
        consecutiveFailures = 0;
    }

    private void fail(final String reason) {
        totalFailures.incrementAndGet();
        consecutiveFailures++;
        if (!stale) {
            LOGGER.warn("Source '{}' unavailable, serving last known state: {}", name, reason);
        }
        stale = true;
    }

    String name() {
        return name;
    }

    boolean isStale() {
        return stale;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }

    long totalFailures() {
        return totalFailures.get();
    }
}
