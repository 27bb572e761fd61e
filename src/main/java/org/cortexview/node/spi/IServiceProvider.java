package org.cortexview.node.spi;

/**
 * Implemented by processes that expose a service to dependent processes. The Node injects the
 * exposed service into every process that names this one in its {@code require} block.
 *
 * <p>Example: ObservatoryProcess exposes the Observatory to HttpServerProcess.</p>
 */
public interface IServiceProvider {

    /**
     * @return The exposed service, or null if there is none.
     */
    Object getExposedService();
}
