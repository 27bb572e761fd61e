package org.cortexview.observatory.snapshot;

import java.util.List;
import java.util.Map;

/**
 * The last readings taken from each source. A stale source keeps contributing its last good reading.
 */
final class SourceReadings {

    private SourceReadings() {
        // Private constructor to prevent instantiation
    }

    /**
     * What the thought stream contributed to a snapshot.
     *
     * @param streamLength Total number of entries in the stream.
     * @param thoughts     Parsed thoughts, newest first.
     */
    record StreamReading(long streamLength, List<ParsedThought> thoughts) {

        static final StreamReading EMPTY = new StreamReading(0L, List.of());

        StreamReading {
            thoughts = List.copyOf(thoughts);
        }
    }

    /**
     * What the memory store contributed to a snapshot.
     */
    record MemoryReading(
        long lifetimeThoughts,
        int restartCount,
        long lifetimeDreams,
        long consciousMemories,
        long unconsciousMemories,
        Map<String, Snapshot.ActorStatus> reportedActors
    ) {

        static final MemoryReading EMPTY = new MemoryReading(0L, 0, 0L, 0L, 0L, Map.of());

        MemoryReading {
            reportedActors = Map.copyOf(reportedActors);
        }
    }
}
