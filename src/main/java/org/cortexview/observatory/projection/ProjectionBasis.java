package org.cortexview.observatory.projection;

/**
 * A fixed linear map from embedding space down to three dimensions.
 * <p>
 * Implementations are immutable once constructed, so every point projected through the same
 * instance lands in the same coordinate frame. The {@link ProjectionEngine} does not know
 * which implementation it holds.
 */
public interface ProjectionBasis {

    /**
     * @return The embedding dimensionality this basis accepts.
     */
    int dimension();

    /**
     * Projects one embedding.
     *
     * @param vector The embedding; its length must equal {@link #dimension()}.
     * @return The three projected coordinates.
     * @throws IllegalArgumentException if the vector has the wrong dimensionality.
     */
    double[] project(float[] vector);

    /**
     * @return The basis kind as reported to observers, e.g. {@code "random"} or {@code "pca"}.
     */
    String type();
}
