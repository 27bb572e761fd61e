package org.cortexview.observatory.api.stores;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single entry of an append-only stream.
 *
 * @param id         The stream entry id as assigned by the store (e.g., "1718000000000-0").
 * @param recordedAt The instant encoded in the entry id.
 * @param fields     The raw field map of the entry.
 */
public record StreamRecord(String id, Instant recordedAt, Map<String, String> fields) {

    public StreamRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(recordedAt, "recordedAt");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /**
     * @param name The field name.
     * @return The field value, or null if the entry does not carry it.
     */
    public String field(final String name) {
        return fields.get(name);
    }
}
