package org.cortexview.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.cortexview.node.spi.IProcess;
import org.cortexview.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * The CortexView node. Instantiates the configured processes in dependency order, starts them,
 * and stops them in reverse order on shutdown.
 *
 * <p>Processes are declared under {@code node.processes}. Each entry names a class implementing
 * {@link IProcess} with a {@code (String, Map, Config)} constructor, its {@code options} block and
 * an optional {@code require} block mapping local dependency names to other process names. A
 * process that implements {@link IServiceProvider} hands its exposed service to the processes
 * that require it.</p>
 *
 * <p>Any process that cannot be created fails the whole node: configuration errors are fatal at
 * startup.</p>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private final List<String> startedProcesses = new ArrayList<>();
    private Thread shutdownHook;
    private boolean stopped = false;

    /**
     * Constructs the Node and all of its processes.
     *
     * @param config The fully resolved application configuration.
     * @throws IllegalStateException if a process definition is invalid or a process cannot be created.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final ConfigException e) {
            throw new IllegalStateException("Invalid node configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Starts all processes in dependency order and registers a shutdown hook.
     *
     * @throws IllegalStateException if a process fails to start; processes already started are stopped again.
     */
    public synchronized void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        for (final Map.Entry<String, IProcess> entry : managedProcesses.entrySet()) {
            try {
                LOGGER.debug("Starting process '{}'...", entry.getKey());
                entry.getValue().start();
                startedProcesses.add(entry.getKey());
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to start process '{}', stopping the node.", entry.getKey(), e);
                stopStartedProcesses();
                throw new IllegalStateException("Process '" + entry.getKey() + "' failed to start", e);
            }
        }

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es). Running until interrupted.", startedProcesses.size());
    }

    /**
     * Stops all started processes in reverse start order. Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOGGER.info("Shutdown sequence initiated...");

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // JVM is already shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        stopStartedProcesses();
        LOGGER.info("All processes stopped.");
    }

    private void stopStartedProcesses() {
        final List<String> names = new ArrayList<>(startedProcesses);
        Collections.reverse(names);
        for (final String name : names) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
        startedProcesses.clear();
    }

    /**
     * @return The managed processes by name, in start order.
     */
    public Map<String, IProcess> getProcesses() {
        return Collections.unmodifiableMap(managedProcesses);
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);
        LOGGER.debug("Found {} configured process(es): {}", processesConfig.size(), processesConfig.keySet());

        final Map<String, ProcessDefinition> processDefs = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            processDefs.put(processName, parseDefinition(processName, processesConfig.toConfig().getConfig(quote(processName))));
        }

        final List<String> orderedProcessNames = topologicalSort(processDefs);
        LOGGER.debug("Process instantiation order: {}", orderedProcessNames);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : orderedProcessNames) {
            final ProcessDefinition def = processDefs.get(processName);

            final Map<String, Object> injectedDeps = new HashMap<>();
            for (final Map.Entry<String, String> reqEntry : def.requires().entrySet()) {
                final Object service = exposedServices.get(reqEntry.getValue());
                if (service == null) {
                    throw new IllegalStateException("Process '" + processName + "' requires a service from '"
                        + reqEntry.getValue() + "', which does not expose one.");
                }
                injectedDeps.put(reqEntry.getKey(), service);
            }

            final IProcess processInstance = instantiate(def, injectedDeps);
            managedProcesses.put(processName, processInstance);

            if (processInstance instanceof IServiceProvider) {
                final Object exposedService = ((IServiceProvider) processInstance).getExposedService();
                if (exposedService != null) {
                    exposedServices.put(processName, exposedService);
                    LOGGER.debug("Process '{}' exposes service: {}", processName, exposedService.getClass().getSimpleName());
                }
            }
        }
        LOGGER.info("Initialized {} process(es): {}", managedProcesses.size(), managedProcesses.keySet());
    }

    private static ProcessDefinition parseDefinition(final String processName, final Config processConfig) {
        if (!processConfig.hasPath("className")) {
            throw new IllegalStateException("Process '" + processName + "' has no 'className'.");
        }
        final Config options = processConfig.hasPath("options")
            ? processConfig.getConfig("options")
            : ConfigFactory.empty();

        final Map<String, String> requires = new LinkedHashMap<>();
        if (processConfig.hasPath("require")) {
            final ConfigObject requireConfig = processConfig.getObject("require");
            for (final String localName : requireConfig.keySet()) {
                requires.put(localName, requireConfig.toConfig().getString(quote(localName)));
            }
        }
        return new ProcessDefinition(processName, processConfig.getString("className"), options, requires);
    }

    private static IProcess instantiate(final ProcessDefinition def, final Map<String, Object> dependencies) {
        try {
            final Class<?> processClass = Class.forName(def.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalStateException("Class " + def.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            return (IProcess) constructor.newInstance(def.name(), dependencies, def.options());
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause();
            throw new IllegalStateException("Failed to initialize process '" + def.name() + "': " + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate process '" + def.name() + "' of class " + def.className(), e);
        }
    }

    /**
     * Orders processes so that every process comes after the processes it requires (Kahn's
     * algorithm). Processes without mutual dependencies keep their configuration order.
     *
     * @throws IllegalStateException on an unknown dependency or a dependency cycle.
     */
    private static List<String> topologicalSort(final Map<String, ProcessDefinition> processDefs) {
        final Map<String, Set<String>> dependents = new HashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String processName : processDefs.keySet()) {
            dependents.put(processName, new LinkedHashSet<>());
            inDegree.put(processName, 0);
        }

        for (final ProcessDefinition def : processDefs.values()) {
            for (final String requiredProcess : def.requires().values()) {
                if (!processDefs.containsKey(requiredProcess)) {
                    throw new IllegalStateException("Process '" + def.name() + "' depends on '" + requiredProcess
                        + "' which is not defined in the configuration.");
                }
                if (dependents.get(requiredProcess).add(def.name())) {
                    inDegree.merge(def.name(), 1, Integer::sum);
                }
            }
        }

        final Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                queue.add(name);
            }
        });

        final List<String> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            result.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (result.size() != processDefs.size()) {
            final List<String> remaining = new ArrayList<>(processDefs.keySet());
            remaining.removeAll(result);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining
                + ". Check the 'require' configuration.");
        }
        return result;
    }

    private static String quote(final String key) {
        return "\"" + key + "\"";
    }

    private record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}
