package org.cortexview.observatory.api.resources;

import java.util.List;
import java.util.Map;

/**
 * An interface for observatory components that can be monitored.
 * <p>
 * Store adapters, the collector, the projection engine and the broadcast hub all report
 * their counters, recent operational errors and health through this interface so that
 * degraded sources can be inspected without exposing the errors to observers.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are metric names (e.g., "ticks", "sessions_evicted") and the values are the
     * corresponding numeric values.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded by the component, oldest first.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is degraded.
     */
    boolean isHealthy();
}
