package org.cortexview.observatory.projection;

import java.util.List;
import java.util.Objects;

/**
 * A named landmark concept and the coordinates it is shown at when its embedding cannot be
 * read from the vector store.
 */
public record AnchorDefinition(String label, double x, double y, double z) {

    /**
     * The four law concepts arranged as a tetrahedron around the origin.
     */
    public static final List<AnchorDefinition> DEFAULTS = List.of(
        new AnchorDefinition("Law 0: Humanity", 0.0, 1.5, 0.0),
        new AnchorDefinition("Law 1: No Harm", 1.4, -0.5, 0.0),
        new AnchorDefinition("Law 2: Obey", -0.7, -0.5, 1.2),
        new AnchorDefinition("Law 3: Self", -0.7, -0.5, -1.2)
    );

    public AnchorDefinition {
        Objects.requireNonNull(label, "label");
        if (label.isBlank()) {
            throw new IllegalArgumentException("Anchor label must not be blank");
        }
    }

    PointCloud.AnchorPoint fallback() {
        return new PointCloud.AnchorPoint(label, x, y, z);
    }
}
