package org.cortexview.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import io.javalin.http.HttpStatus;
import org.cortexview.node.processes.AbstractProcess;
import org.cortexview.node.processes.http.api.dto.ErrorResponseDto;
import org.cortexview.node.spi.IController;
import org.cortexview.node.spi.ServiceRegistry;
import org.cortexview.observatory.Observatory;
import org.cortexview.observatory.broadcast.BroadcastHub;
import org.cortexview.observatory.json.ObservatoryJson;
import org.cortexview.observatory.projection.ProjectionEngine;
import org.cortexview.observatory.snapshot.SnapshotStore;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the Javalin server that exposes the observatory. Routes are declared in the
 * {@code routes} block: every {@code "$controller"} entry names an {@link IController} class,
 * which is created with the server's {@link ServiceRegistry} and mounted at the path of the
 * enclosing keys.
 *
 * <pre>
 * network { host = "127.0.0.1", port = 3000 }
 * cors.enabled = true
 * routes {
 *   health { "$controller" { className = "...HealthController" } }
 * }
 * </pre>
 *
 * <p>Requires the {@code observatory} dependency. Its snapshot store, broadcast hub and
 * projection engine are registered for controllers.</p>
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";

    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final String host;
    private final int port;
    private final boolean corsEnabled;
    private Javalin app;

    /**
     * @param processName  The name of this process in the configuration.
     * @param dependencies Must contain {@code observatory}.
     * @param options      Network, CORS and route settings.
     * @throws IllegalArgumentException if the listen address or a route is invalid.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options.withFallback(ConfigFactory.parseMap(Map.of(
            "network.host", "127.0.0.1",
            "network.port", 3000,
            "cors.enabled", false
        ))));

        final Observatory observatory = getDependency("observatory", Observatory.class);
        controllerRegistry.register(Observatory.class, observatory);
        controllerRegistry.register(SnapshotStore.class, observatory.getSnapshotStore());
        controllerRegistry.register(BroadcastHub.class, observatory.getHub());
        controllerRegistry.register(ProjectionEngine.class, observatory.getProjectionEngine());

        try {
            this.host = this.options.getString("network.host");
            this.port = this.options.getInt("network.port");
            this.corsEnabled = this.options.getBoolean("cors.enabled");
        } catch (final ConfigException e) {
            throw new IllegalArgumentException("Invalid network configuration for '" + processName + "': " + e.getMessage(), e);
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("network.host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("network.port must be within 0-65535, got " + port);
        }

        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} route(s)", processName, routeDefinitions.size());
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }
        app = createApp();
        app.start(host, port);
        LOGGER.info("HTTP server listening on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * Builds the configured application without starting it.
     *
     * @return The Javalin application with all routes registered.
     */
    public Javalin createApp() {
        final Javalin created = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });

            final int minThreads = options.hasPath("network.threadPool.minThreads")
                ? options.getInt("network.threadPool.minThreads")
                : 8;
            final int maxThreads = options.hasPath("network.threadPool.maxThreads")
                ? options.getInt("network.threadPool.maxThreads")
                : 200;
            final int idleTimeout = options.hasPath("network.threadPool.idleTimeoutMs")
                ? options.getInt("network.threadPool.idleTimeoutMs")
                : 60000;
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;

            if (corsEnabled) {
                config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
                LOGGER.debug("CORS enabled for any origin");
            }
        });

        created.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType("application/json")
                .result(ObservatoryJson.write(ErrorResponseDto.of(
                    HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                    HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                    "An internal server error occurred.")));
        });

        for (final RouteDefinition def : routeDefinitions) {
            createController(def).registerRoutes(created, def.basePath());
        }
        return created;
    }

    /**
     * @return The port the server is bound to, or the configured port if it is not running.
     */
    public int getPort() {
        return app != null ? app.port() : port;
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in the http server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();

            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() != ConfigValueType.OBJECT) {
                    throw new IllegalArgumentException("Invalid '$controller' at path '" + currentPath + "', expected an object.");
                }
                final Config controllerConfig = ((ConfigObject) value).toConfig();
                if (!controllerConfig.hasPath("className")) {
                    throw new IllegalArgumentException("'$controller' at path '" + currentPath + "' has no className.");
                }
                routeDefinitions.add(new RouteDefinition(
                    currentPath,
                    controllerConfig.getString("className"),
                    controllerConfig.hasPath("options") ? controllerConfig.getConfig("options") : ConfigFactory.empty()));
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, (currentPath + key + "/").replaceAll("//", "/"));
            }
        }
    }

    private IController createController(final RouteDefinition def) {
        LOGGER.debug("Registering controller '{}' at base path '{}'", def.className(), def.basePath());
        try {
            final Class<?> controllerClass = Class.forName(def.className());
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + def.className() + " does not implement IController.");
            }
            final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(controllerRegistry, def.options());
        } catch (final InvocationTargetException e) {
            throw new IllegalArgumentException("Controller " + def.className() + " failed to initialize: "
                + e.getCause().getMessage(), e.getCause());
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate controller " + def.className(), e);
        }
    }

    private record RouteDefinition(String basePath, String className, Config options) {
    }
}
