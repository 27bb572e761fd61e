package org.cortexview.observatory.projection;

import java.util.Random;

/**
 * Gaussian random projection. Entries are drawn from a seeded generator and each of the three
 * columns is normalized to unit length, so the same seed and dimension always yield the same
 * basis.
 */
public final class RandomProjectionBasis implements ProjectionBasis {

    public static final String TYPE = "random";
    public static final long DEFAULT_SEED = 42L;

    private final int dimension;
    private final double[][] columns;

    public RandomProjectionBasis(final int dimension, final long seed) {
        if (dimension <= 3) {
            throw new IllegalArgumentException("Projection dimension must be greater than 3, got " + dimension);
        }
        this.dimension = dimension;
        this.columns = new double[3][dimension];

        final Random random = new Random(seed);
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < 3; j++) {
                columns[j][i] = random.nextGaussian();
            }
        }
        for (final double[] column : columns) {
            final double norm = LinearAlgebra.norm(column);
            if (norm > 0.0) {
                LinearAlgebra.scale(column, 1.0 / norm);
            }
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] project(final float[] vector) {
        LinearAlgebra.requireDimension(vector, dimension);
        return new double[] {
            LinearAlgebra.dot(columns[0], vector),
            LinearAlgebra.dot(columns[1], vector),
            LinearAlgebra.dot(columns[2], vector)
        };
    }

    @Override
    public String type() {
        return TYPE;
    }
}
