package org.cortexview.observatory.snapshot;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Settings of the {@link SnapshotCollector}.
 *
 * @param identityName          The name reported in {@code identity.name}.
 * @param knownActors           Actors always present in {@code actors}, in display order.
 * @param thoughtWindow         Number of stream entries read per tick, at most {@link Snapshot#MAX_RECENT_THOUGHTS}.
 * @param sourceTimeout         Per-source read timeout for one tick.
 * @param identityCollection    Collection holding the identity point.
 * @param identityPointId       Id of the identity point.
 * @param consciousCollection   Collection counted as conscious memories.
 * @param unconsciousCollection Collection counted as unconscious memories.
 */
public record CollectorSettings(
    String identityName,
    List<String> knownActors,
    int thoughtWindow,
    Duration sourceTimeout,
    String identityCollection,
    String identityPointId,
    String consciousCollection,
    String unconsciousCollection
) {

    public CollectorSettings {
        knownActors = List.copyOf(knownActors);
        if (thoughtWindow <= 0 || thoughtWindow > Snapshot.MAX_RECENT_THOUGHTS) {
            throw new IllegalArgumentException("thoughtWindow must be in [1, " + Snapshot.MAX_RECENT_THOUGHTS + "], got " + thoughtWindow);
        }
        if (sourceTimeout.isNegative() || sourceTimeout.isZero()) {
            throw new IllegalArgumentException("sourceTimeoutMs must be positive, got " + sourceTimeout.toMillis());
        }
    }

    /**
     * Parses the {@code collector} configuration block.
     *
     * @param options The collector options.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static CollectorSettings fromConfig(final Config options) {
        final Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "identityName", "Timmy",
            "knownActors", List.of("MemoryActor", "AttentionActor", "SalienceActor", "VolitionActor"),
            "thoughtWindow", Snapshot.MAX_RECENT_THOUGHTS,
            "sourceTimeoutMs", 150,
            "identityCollection", "identity",
            "identityPointId", "00000000-0000-0000-0000-000000000001",
            "consciousCollection", "memories",
            "unconsciousCollection", "unconscious"
        )));
        try {
            return new CollectorSettings(
                config.getString("identityName"),
                config.getStringList("knownActors"),
                config.getInt("thoughtWindow"),
                Duration.ofMillis(config.getLong("sourceTimeoutMs")),
                config.getString("identityCollection"),
                config.getString("identityPointId"),
                config.getString("consciousCollection"),
                config.getString("unconsciousCollection"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid collector configuration: " + e.getMessage(), e);
        }
    }
}
