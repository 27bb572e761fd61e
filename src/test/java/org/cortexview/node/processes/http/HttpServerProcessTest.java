package org.cortexview.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.javalin.testtools.JavalinTest;
import org.cortexview.junit.extensions.logging.ExpectLog;
import org.cortexview.junit.extensions.logging.LogLevel;
import org.cortexview.junit.extensions.logging.LogWatchExtension;
import org.cortexview.observatory.Observatory;
import org.cortexview.testutils.MutableClock;
import org.cortexview.testutils.Observatories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class HttpServerProcessTest {

    private static final String ROUTES = """
        routes {
          health { "$controller" { className = "org.cortexview.node.processes.http.api.observer.HealthController" } }
          api {
            v1 {
              metrics { "$controller" { className = "org.cortexview.node.processes.http.api.observer.MetricsController" } }
            }
          }
        }
        """;

    private Observatory observatory;

    @BeforeEach
    void setUp() throws Exception {
        observatory = Observatories.create(Observatories.streamWithTwoThoughts(), Observatories.vectorsWithMemories(),
            new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        observatory.stop();
    }

    private HttpServerProcess process(final String config) {
        return new HttpServerProcess("httpServer", Map.of("observatory", observatory), ConfigFactory.parseString(config));
    }

    @Test
    @DisplayName("Nested route keys become the controller's base path")
    void createApp_mountsControllersAtNestedPaths() {
        final HttpServerProcess server = process(ROUTES);

        JavalinTest.test(server.createApp(), (app, client) -> {
            assertThat(client.get("/health").code()).isEqualTo(200);
            assertThat(client.get("/api/v1/metrics").code()).isEqualTo(503);
            assertThat(client.get("/metrics").code()).isEqualTo(404);
        });
    }

    @Test
    void createApp_corsAllowsAnyOrigin() {
        final HttpServerProcess server = process("cors.enabled = true\n" + ROUTES);

        JavalinTest.test(server.createApp(), (app, client) -> {
            var response = client.get("/health", request -> request.header("Origin", "http://viewer.example"));
            assertThat(response.header("Access-Control-Allow-Origin")).isNotNull();
        });
    }

    @Test
    void createApp_corsDisabledByDefault() {
        final HttpServerProcess server = process(ROUTES);

        JavalinTest.test(server.createApp(), (app, client) -> {
            var response = client.get("/health", request -> request.header("Origin", "http://viewer.example"));
            assertThat(response.header("Access-Control-Allow-Origin")).isNull();
        });
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, messagePattern = "HTTP server listening on 127.0.0.1:\\d+")
    @ExpectLog(level = LogLevel.INFO, messagePattern = "HTTP server stopped.")
    void startAndStop_bindsEphemeralPort() {
        final HttpServerProcess server = process("network.port = 0\n" + ROUTES);

        server.start();
        try {
            assertThat(server.getPort()).isPositive();
        } finally {
            server.stop();
        }
        server.stop();
    }

    @Test
    void constructor_rejectsInvalidPort() {
        assertThatThrownBy(() -> process("network.port = 70000\n" + ROUTES))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("70000");
    }

    @Test
    void constructor_rejectsBlankHost() {
        assertThatThrownBy(() -> process("network.host = \" \"\n" + ROUTES))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_requiresObservatory() {
        final Config config = ConfigFactory.parseString(ROUTES);

        assertThatThrownBy(() -> new HttpServerProcess("httpServer", Map.of(), config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("observatory");
    }

    @Test
    void constructor_rejectsControllerWithoutClassName() {
        assertThatThrownBy(() -> process("routes { broken { \"$controller\" { options {} } } }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("className");
    }

    @Test
    void createApp_rejectsUnknownControllerClass() {
        final HttpServerProcess server = process("routes { x { \"$controller\" { className = \"org.nonexistent.Controller\" } } }");

        assertThatThrownBy(server::createApp).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No 'routes' block found in the http server configuration. No routes will be served.")
    void constructor_warnsWithoutRoutes() {
        process("network.port = 0");
    }
}
