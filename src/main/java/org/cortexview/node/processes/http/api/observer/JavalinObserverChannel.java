package org.cortexview.node.processes.http.api.observer;

import io.javalin.websocket.WsContext;
import org.cortexview.observatory.broadcast.IObserverChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Adapts a Javalin WebSocket connection to an {@link IObserverChannel}.
 */
final class JavalinObserverChannel implements IObserverChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(JavalinObserverChannel.class);

    private final WsContext ctx;

    JavalinObserverChannel(final WsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public String id() {
        return ctx.sessionId();
    }

    /**
     * Blocking write. {@link WsContext#send(String)} propagates the transport's IOException
     * without declaring it.
     */
    @Override
    public void send(final String payload) throws IOException {
        ctx.send(payload);
    }

    @Override
    public void close() {
        try {
            if (ctx.session.isOpen()) {
                ctx.closeSession();
            }
        } catch (RuntimeException e) {
            LOGGER.debug("Closing observer session '{}' failed: {}", ctx.sessionId(), e.getMessage());
        }
    }
}
