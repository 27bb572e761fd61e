package org.cortexview.node.processes.http.api.observer;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import org.cortexview.node.processes.http.AbstractController;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.broadcast.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket push channel. Each connection becomes a session of the {@link BroadcastHub}, which
 * sends the current snapshot on connect and every new one after that. Inbound messages are
 * ignored.
 */
public class SnapshotStreamController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotStreamController.class);

    private final BroadcastHub hub;

    public SnapshotStreamController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.hub = registry.get(BroadcastHub.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.ws(endpoint(basePath), ws -> {
            ws.onConnect(ctx -> {
                LOGGER.debug("Observer connected from {}", ctx.session.getRemoteAddress());
                hub.register(new JavalinObserverChannel(ctx));
            });
            ws.onMessage(ctx -> LOGGER.trace("Ignoring inbound message on session '{}'", ctx.sessionId()));
            ws.onClose(ctx -> {
                LOGGER.debug("Observer session '{}' closed ({})", ctx.sessionId(), ctx.status());
                hub.unregister(ctx.sessionId());
            });
            ws.onError(ctx -> {
                LOGGER.debug("Observer session '{}' failed: {}", ctx.sessionId(),
                    ctx.error() != null ? ctx.error().getMessage() : "unknown error");
                hub.unregister(ctx.sessionId());
            });
        });
    }
}
