package org.cortexview.observatory.broadcast;

import java.time.Instant;
import java.util.Objects;

/**
 * A snapshot serialized once per tick and shared by every session.
 *
 * @param timestamp The snapshot timestamp, used to keep per-session delivery ordered.
 * @param json      The serialized snapshot.
 */
public record SnapshotPayload(Instant timestamp, String json) {

    public SnapshotPayload {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(json, "json");
    }
}
