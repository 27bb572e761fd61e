package org.cortexview.observatory.resources;

import com.typesafe.config.Config;
import org.cortexview.observatory.api.resources.IMonitorable;
import org.cortexview.observatory.api.resources.OperationalError;
import org.cortexview.observatory.api.stores.SourceUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Abstract base class for the read-only store adapters, providing name and configuration
 * handling, request accounting and bounded error tracking.
 * <p>
 * <strong>Error Handling Guidelines for Store Adapters:</strong>
 * <ul>
 *   <li>Every failed read is converted into a {@link SourceUnavailableException} via
 *       {@link #unavailable(String, String, Throwable)}, which also records an
 *       {@link OperationalError}.</li>
 *   <li>Adapters log failures at DEBUG only. The caller decides whether the failure is worth
 *       a WARN (it knows whether the source just became stale).</li>
 *   <li>Adapters never retry; the next tick is the retry.</li>
 * </ul>
 */
public abstract class AbstractStoreResource implements IMonitorable, AutoCloseable {

    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile boolean lastRequestFailed = false;

    /**
     * Constructor for AbstractStoreResource.
     *
     * @param name    The name of the store, used in logs and errors.
     * @param options The configuration object for this store.
     */
    protected AbstractStoreResource(final String name, final Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * Marks the start of a request against the store.
     */
    protected void countRequest() {
        requests.incrementAndGet();
    }

    /**
     * Marks the last request as successful.
     */
    protected void markSuccess() {
        lastRequestFailed = false;
    }

    /**
     * Records a failed request and builds the exception the caller should throw.
     *
     * @param code    Error code for categorization (e.g., "CONNECTION_FAILED", "BAD_RESPONSE").
     * @param message Human-readable error message.
     * @param cause   The underlying cause, may be null.
     * @return The exception to throw.
     */
    protected SourceUnavailableException unavailable(final String code, final String message, final Throwable cause) {
        failures.incrementAndGet();
        lastRequestFailed = true;
        final String details = cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null;
        recordError(code, message, details);
        return cause != null
            ? new SourceUnavailableException(resourceName, message, cause)
            : new SourceUnavailableException(resourceName, message);
    }

    protected void recordError(final String code, final String message, final String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        final int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
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
     * A store is healthy as long as its most recent request succeeded. Older errors stay in
     * {@link #getErrors()} for inspection but do not affect health.
     */
    @Override
    public boolean isHealthy() {
        return !lastRequestFailed;
    }

    @Override
    public final Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("requests", requests.get());
        metrics.put("failures", failures.get());
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add store-specific metrics. The default adds nothing.
     *
     * @param metrics The mutable metrics map.
     */
    protected void addCustomMetrics(final Map<String, Number> metrics) {
    }

    @Override
    public void close() {
    }
}
