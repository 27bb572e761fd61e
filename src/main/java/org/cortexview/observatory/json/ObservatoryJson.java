package org.cortexview.observatory.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * The single JSON mapping used for everything sent to observers: snake_case property
 * names and ISO-8601 instants.
 * <p>
 * Serialization of the same value always yields the same bytes, which the gateway relies on
 * for repeated reads between ticks.
 */
public final class ObservatoryJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ObservatoryJson() {
        // Private constructor to prevent instantiation
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a value to its JSON text.
     *
     * @param value The value to serialize.
     * @return The JSON text.
     * @throws IllegalStateException if the value cannot be serialized, which indicates a programming error.
     */
    public static String write(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
