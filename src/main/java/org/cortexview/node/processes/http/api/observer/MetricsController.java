package org.cortexview.node.processes.http.api.observer;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.cortexview.node.processes.http.AbstractController;
import org.cortexview.node.processes.http.api.dto.StatusResponseDto;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.json.ObservatoryJson;
import org.cortexview.observatory.snapshot.Snapshot;
import org.cortexview.observatory.snapshot.SnapshotStore;

import java.util.Optional;

/**
 * Serves the current snapshot. Answers 503 with {@code {"status":"initializing"}} until the
 * first collector tick has published one.
 */
public class MetricsController extends AbstractController {

    private final SnapshotStore store;

    public MetricsController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.store = registry.get(SnapshotStore.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(endpoint(basePath), this::getMetrics);
    }

    void getMetrics(final Context ctx) {
        final Optional<Snapshot> snapshot = store.current();
        if (snapshot.isEmpty()) {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType("application/json")
                .result(ObservatoryJson.write(StatusResponseDto.INITIALIZING));
            return;
        }
        ctx.status(HttpStatus.OK).contentType("application/json").result(ObservatoryJson.write(snapshot.get()));
    }
}
