package org.cortexview.observatory.api.stores;

import java.util.Map;
import java.util.Objects;

/**
 * A point read from the vector store.
 *
 * @param id      The point id rendered as a string (UUID or number).
 * @param vector  The dense embedding, or an empty array if vectors were not requested.
 * @param payload The point payload as plain Java values (String, Number, Boolean, List, Map).
 */
public record VectorRecord(String id, float[] vector, Map<String, Object> payload) {

    public VectorRecord {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? new float[0] : vector;
        payload = payload == null ? Map.of() : payload;
    }

    /**
     * @return The dimensionality of the embedding.
     */
    public int dimension() {
        return vector.length;
    }

    /**
     * Reads a numeric payload field.
     *
     * @param key      The payload key.
     * @param fallback The value returned when the key is missing or not numeric.
     * @return The numeric value as double.
     */
    public double payloadDouble(final String key, final double fallback) {
        final Object value = payload.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : fallback;
    }

    /**
     * Reads a textual payload field.
     *
     * @param key The payload key.
     * @return The value, or null if missing or not a string.
     */
    public String payloadString(final String key) {
        final Object value = payload.get(key);
        return value instanceof String ? (String) value : null;
    }
}
