package org.cortexview.observatory.projection;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one projection refresh.
 *
 * @param points         Projected memory samples.
 * @param anchors        Fixed landmark coordinates, identical for every cloud built on the same basis.
 * @param generatedAt    When the refresh ran.
 * @param projectionType The basis kind, see {@link ProjectionBasis#type()}.
 * @param droppedSamples Samples skipped in this refresh because of a dimension mismatch.
 */
public record PointCloud(List<VectorPoint> points,
                         List<AnchorPoint> anchors,
                         Instant generatedAt,
                         String projectionType,
                         int droppedSamples) {

    public PointCloud {
        points = List.copyOf(points);
        anchors = List.copyOf(anchors);
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(projectionType, "projectionType");
    }

    /**
     * One projected memory.
     *
     * @param id         The point id in the vector store.
     * @param ageSeconds Seconds since the memory was encoded; 0 if unknown.
     */
    public record VectorPoint(String id, double x, double y, double z, double salience, long ageSeconds) {
    }

    /**
     * One landmark.
     */
    public record AnchorPoint(String label, double x, double y, double z) {
    }
}
