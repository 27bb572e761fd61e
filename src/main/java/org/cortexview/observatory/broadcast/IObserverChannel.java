package org.cortexview.observatory.broadcast;

import java.io.IOException;

/**
 * The outbound half of one observer connection, as seen by the {@link BroadcastHub}.
 * Implementations wrap a transport such as a WebSocket session.
 */
public interface IObserverChannel {

    /**
     * @return A stable identifier of the connection, unique among live connections.
     */
    String id();

    /**
     * Writes one message. May block; the hub only calls it from the session's own send loop.
     *
     * @param payload The message text.
     * @throws IOException if the connection is broken.
     */
    void send(String payload) throws IOException;

    /**
     * Closes the connection. Must not throw and must be safe to call more than once.
     */
    void close();
}
