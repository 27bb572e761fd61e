package org.cortexview.node.processes.http.api.observer;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.cortexview.node.processes.http.AbstractController;
import org.cortexview.node.processes.http.api.dto.HealthResponseDto;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.Observatory;
import org.cortexview.observatory.json.ObservatoryJson;
import org.cortexview.observatory.snapshot.SnapshotCollector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint. Always answers 200 while the process runs; store outages only show up as
 * stale sources.
 */
public class HealthController extends AbstractController {

    private final Observatory observatory;
    private final String serviceName;

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.observatory = registry.get(Observatory.class);
        this.serviceName = options.hasPath("serviceName") ? options.getString("serviceName") : "cortexview";
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(endpoint(basePath), this::getHealth);
    }

    void getHealth(final Context ctx) {
        final Map<String, String> sources = new LinkedHashMap<>();
        sources.put(SnapshotCollector.STREAM_SOURCE, freshness(observatory.getCollector().isStale(SnapshotCollector.STREAM_SOURCE)));
        sources.put(SnapshotCollector.MEMORY_SOURCE, freshness(observatory.getCollector().isStale(SnapshotCollector.MEMORY_SOURCE)));
        sources.put("vectors", freshness(observatory.getProjectionEngine().isStale()));

        final HealthResponseDto health = new HealthResponseDto(
            "ok",
            serviceName,
            observatory.getUptimeSeconds(),
            observatory.getHub().getSessionCount(),
            sources);
        ctx.status(HttpStatus.OK).contentType("application/json").result(ObservatoryJson.write(health));
    }

    private static String freshness(final boolean stale) {
        return stale ? "stale" : "fresh";
    }
}
