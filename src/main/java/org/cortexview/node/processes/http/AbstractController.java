package org.cortexview.node.processes.http;

import com.typesafe.config.Config;
import org.cortexview.node.spi.IController;
import org.cortexview.node.spi.ServiceRegistry;

/**
 * Base class for {@link IController} implementations. Every controller is created with the
 * server's {@link ServiceRegistry} and its own options block.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry Shared components available to controllers.
     * @param options  The controller's {@code options} block.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Turns a configured base path such as {@code "/health/"} into the endpoint path
     * {@code "/health"}. The root path stays {@code "/"}.
     */
    protected static String endpoint(final String basePath) {
        final String path = basePath.replaceAll("/{2,}", "/");
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
