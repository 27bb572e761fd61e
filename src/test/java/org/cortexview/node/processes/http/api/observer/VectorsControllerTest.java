package org.cortexview.node.processes.http.api.observer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.Observatory;
import org.cortexview.observatory.projection.ProjectionEngine;
import org.cortexview.testutils.MutableClock;
import org.cortexview.testutils.Observatories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VectorsControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private Observatory observatory;
    private Javalin app;

    @BeforeEach
    void setUp() throws Exception {
        observatory = Observatories.create(Observatories.streamWithTwoThoughts(), Observatories.vectorsWithMemories(),
            new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));

        final ServiceRegistry registry = new ServiceRegistry();
        registry.register(ProjectionEngine.class, observatory.getProjectionEngine());
        app = Javalin.create();
        new VectorsController(registry, ConfigFactory.empty()).registerRoutes(app, "/vectors/");
    }

    @AfterEach
    void tearDown() {
        observatory.stop();
    }

    @Test
    void answersInitializingBeforeFirstRefresh() {
        JavalinTest.test(app, (server, client) -> {
            var response = client.get("/vectors");
            assertThat(response.code()).isEqualTo(503);
            assertThat(response.body().string()).contains("initializing");
        });
    }

    @Test
    void servesPointCloudWithStableAnchors() {
        observatory.getProjectionEngine().refresh();

        JavalinTest.test(app, (server, client) -> {
            var response = client.get("/vectors");
            assertThat(response.code()).isEqualTo(200);
            final JsonNode first = mapper.readTree(response.body().string());

            assertThat(first.path("points")).hasSize(3);
            assertThat(first.path("points").get(0).path("salience").asDouble()).isEqualTo(0.7);
            assertThat(first.path("points").get(0).has("age_seconds")).isTrue();
            assertThat(first.path("anchors")).hasSize(4);
            assertThat(first.path("generated_at").asText()).isEqualTo("2026-01-01T00:00:00Z");

            observatory.getProjectionEngine().refresh();
            final JsonNode second = mapper.readTree(client.get("/vectors").body().string());
            assertThat(second.path("anchors")).isEqualTo(first.path("anchors"));
            assertThat(second.path("points")).isEqualTo(first.path("points"));
        });
    }
}
