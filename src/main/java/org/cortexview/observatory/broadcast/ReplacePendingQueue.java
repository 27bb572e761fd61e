package org.cortexview.observatory.broadcast;

import java.util.ArrayDeque;

/**
 * A bounded FIFO that never rejects an offer: when full, the oldest pending element is
 * discarded to make room for the new one. With capacity 1 a newer element simply replaces
 * the undelivered older one.
 *
 * @param <T> The element type.
 */
public final class ReplacePendingQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> elements;
    private long replaced = 0;

    public ReplacePendingQueue(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    /**
     * Adds an element, discarding the oldest pending ones if the queue is full.
     *
     * @param element The element, never null.
     * @return The number of elements discarded by this offer.
     */
    public synchronized int offer(final T element) {
        if (element == null) {
            throw new NullPointerException("element");
        }
        int discarded = 0;
        while (elements.size() >= capacity) {
            elements.pollFirst();
            discarded++;
        }
        elements.addLast(element);
        replaced += discarded;
        return discarded;
    }

    /**
     * @return The oldest pending element, or null if the queue is empty.
     */
    public synchronized T poll() {
        return elements.pollFirst();
    }

    public synchronized int size() {
        return elements.size();
    }

    public synchronized boolean isEmpty() {
        return elements.isEmpty();
    }

    public synchronized void clear() {
        elements.clear();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return The total number of elements discarded so far.
     */
    public synchronized long replacedCount() {
        return replaced;
    }
}
