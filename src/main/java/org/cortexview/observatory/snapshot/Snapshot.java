package org.cortexview.observatory.snapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable, fully formed point-in-time state of the observed process.
 * <p>
 * A new instance is built on every collector tick; instances are never modified after
 * construction, so every field of one snapshot is derived from the same set of readings.
 * All collections are unmodifiable copies. {@code actors} keeps the configured actor order.
 *
 * @param timestamp      When the snapshot was assembled. Non-decreasing across ticks.
 * @param identity       Identity counters.
 * @param cognitive      Memory and cycle counters.
 * @param emotional      Emotional state, including the derived fields.
 * @param actors         Actor name to liveness.
 * @param recentThoughts Up to {@link #MAX_RECENT_THOUGHTS} thoughts, newest first.
 */
public record Snapshot(
    Instant timestamp,
    Identity identity,
    Cognitive cognitive,
    Emotional emotional,
    Map<String, ActorStatus> actors,
    List<ThoughtSummary> recentThoughts
) {

    public static final int MAX_RECENT_THOUGHTS = 20;

    public Snapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(cognitive, "cognitive");
        Objects.requireNonNull(emotional, "emotional");
        actors = Collections.unmodifiableMap(new LinkedHashMap<>(actors));
        if (recentThoughts.size() > MAX_RECENT_THOUGHTS) {
            recentThoughts = recentThoughts.subList(0, MAX_RECENT_THOUGHTS);
        }
        recentThoughts = List.copyOf(recentThoughts);
    }

    public record Identity(
        String name,
        long uptimeSeconds,
        long lifetimeThoughts,
        long sessionThoughts,
        int restartCount
    ) {
    }

    public record Cognitive(
        long consciousMemories,
        long unconsciousMemories,
        long lifetimeDreams,
        long currentCycle
    ) {
    }

    /**
     * @param valence            In [-1, 1].
     * @param arousal            In [0, 1].
     * @param dominance          In [0, 1].
     * @param connectionDrive    In [0, 1], derived.
     * @param emotionalIntensity In [0, 1], derived.
     */
    public record Emotional(
        double valence,
        double arousal,
        double dominance,
        double connectionDrive,
        double emotionalIntensity
    ) {
    }

    public record ActorStatus(boolean alive, int restartCount) {

        public static final ActorStatus MISSING = new ActorStatus(false, 0);
    }

    public record ThoughtSummary(
        String id,
        String contentPreview,
        double salience,
        Instant timestamp
    ) {
    }
}
