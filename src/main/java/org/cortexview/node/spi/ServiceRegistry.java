package org.cortexview.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed holder of the shared components controllers may use.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service instance.
     *
     * @param type     The type under which the instance is looked up.
     * @param instance The instance.
     * @param <T>      The service type.
     * @throws IllegalArgumentException if a service of this type is already registered.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * @param type The service type.
     * @param <T>  The service type.
     * @return The registered instance.
     * @throws IllegalArgumentException if no service of this type is registered.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
