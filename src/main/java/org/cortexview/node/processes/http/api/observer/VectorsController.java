package org.cortexview.node.processes.http.api.observer;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.cortexview.node.processes.http.AbstractController;
import org.cortexview.node.processes.http.api.dto.StatusResponseDto;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.json.ObservatoryJson;
import org.cortexview.observatory.projection.PointCloud;
import org.cortexview.observatory.projection.ProjectionEngine;

import java.util.Optional;

/**
 * Serves the current point cloud. Answers 503 until the first projection refresh.
 */
public class VectorsController extends AbstractController {

    private final ProjectionEngine engine;

    public VectorsController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.engine = registry.get(ProjectionEngine.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(endpoint(basePath), this::getVectors);
    }

    void getVectors(final Context ctx) {
        final Optional<PointCloud> cloud = engine.current();
        if (cloud.isEmpty()) {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType("application/json")
                .result(ObservatoryJson.write(StatusResponseDto.INITIALIZING));
            return;
        }
        ctx.status(HttpStatus.OK).contentType("application/json").result(ObservatoryJson.write(cloud.get()));
    }
}
