package org.cortexview.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP or WebSocket endpoint group served by the HttpServerProcess.
 */
public interface IController {

    /**
     * Registers this controller's handlers.
     *
     * @param app      The Javalin application.
     * @param basePath The path configured for this controller, ending with a slash.
     */
    void registerRoutes(Javalin app, String basePath);
}
