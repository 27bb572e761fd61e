package org.cortexview.node.processes.http.api.observer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import org.cortexview.node.processes.http.HttpServerProcess;
import org.cortexview.observatory.Observatory;
import org.cortexview.observatory.snapshot.Snapshot;
import org.cortexview.testutils.MutableClock;
import org.cortexview.testutils.Observatories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Runs the push channel over a real socket.
 */
@Tag("unit")
class SnapshotStreamControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private Observatory observatory;
    private HttpServerProcess server;
    private final List<WebSocket> sockets = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        observatory = Observatories.create(Observatories.streamWithTwoThoughts(), Observatories.vectorsWithMemories(), clock);
        server = new HttpServerProcess("httpServer", Map.of("observatory", observatory), ConfigFactory.parseString("""
            network.port = 0
            routes {
              ws { "$controller" { className = "org.cortexview.node.processes.http.api.observer.SnapshotStreamController" } }
            }
            """));
        server.start();
    }

    @AfterEach
    void tearDown() {
        for (final WebSocket socket : sockets) {
            socket.abort();
        }
        server.stop();
        observatory.stop();
    }

    private Observer connect() throws Exception {
        final Observer observer = new Observer();
        final WebSocket socket = HttpClient.newHttpClient().newWebSocketBuilder()
            .buildAsync(URI.create("ws://127.0.0.1:" + server.getPort() + "/ws"), observer)
            .get(5, TimeUnit.SECONDS);
        sockets.add(socket);
        observer.socket = socket;
        return observer;
    }

    private void tick() {
        final Snapshot snapshot = observatory.getCollector().tick();
        observatory.getHub().onTick(snapshot);
    }

    @Test
    @DisplayName("A new observer gets the current snapshot first, then every new one")
    void connect_receivesCurrentThenSubsequentSnapshots() throws Exception {
        tick();

        final Observer observer = connect();
        await().atMost(WAIT).until(() -> observer.messages.size() == 1);
        assertThat(mapper.readTree(observer.messages.get(0)).path("timestamp").asText()).isEqualTo("2026-01-01T00:00:00Z");

        clock.advance(Duration.ofMillis(200));
        tick();

        await().atMost(WAIT).until(() -> observer.messages.size() == 2);
        final JsonNode second = mapper.readTree(observer.messages.get(1));
        assertThat(second.path("timestamp").asText()).isEqualTo("2026-01-01T00:00:00.200Z");
        assertThat(second.path("recent_thoughts")).hasSize(2);
    }

    @Test
    @DisplayName("Every connected observer receives each broadcast")
    void broadcast_reachesAllObservers() throws Exception {
        final Observer first = connect();
        final Observer second = connect();
        await().atMost(WAIT).until(() -> observatory.getHub().getSessionCount() == 2);

        tick();

        await().atMost(WAIT).until(() -> first.messages.size() == 1 && second.messages.size() == 1);
        assertThat(first.messages).isEqualTo(second.messages);
    }

    @Test
    @DisplayName("Inbound messages are ignored and closing unregisters the session")
    void close_unregistersSession() throws Exception {
        final Observer observer = connect();
        await().atMost(WAIT).until(() -> observatory.getHub().getSessionCount() == 1);

        observer.socket.sendText("hello", true).get(5, TimeUnit.SECONDS);
        observer.socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);

        await().atMost(WAIT).until(() -> observatory.getHub().getSessionCount() == 0);
        assertThat(observer.messages).isEmpty();
    }

    private static final class Observer implements WebSocket.Listener {

        private final List<String> messages = new CopyOnWriteArrayList<>();
        private final StringBuilder partial = new StringBuilder();
        private volatile WebSocket socket;

        @Override
        public CompletionStage<?> onText(final WebSocket webSocket, final CharSequence data, final boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }
    }
}
