package org.cortexview.observatory.projection;

import java.util.List;
import java.util.Random;

/**
 * Projection onto the top three principal components of a sample batch.
 * <p>
 * The components are found by power iteration on the sample covariance, re-orthogonalizing
 * against the components already found after every step. The covariance matrix is never
 * materialized; each step computes {@code X^T (X v) / n} from the centered samples. Each
 * component's sign is fixed so that its largest-magnitude entry is positive, which makes the
 * result deterministic for a given batch.
 * <p>
 * Directions without variance (fewer samples than components, or duplicated samples) fall back
 * to the seeded start vector orthogonalized against the earlier components.
 */
public final class PcaProjectionBasis implements ProjectionBasis {

    public static final String TYPE = "pca";

    private static final int MAX_ITERATIONS = 200;
    private static final double CONVERGENCE = 1e-10;
    private static final double ZERO_VARIANCE = 1e-12;

    private final int dimension;
    private final double[] mean;
    private final double[][] components;
    private final double[] variances;

    private PcaProjectionBasis(final int dimension, final double[] mean, final double[][] components, final double[] variances) {
        this.dimension = dimension;
        this.mean = mean;
        this.components = components;
        this.variances = variances;
    }

    /**
     * Fits a basis to the given samples.
     *
     * @param samples   Sample embeddings, all of length {@code dimension}. Must not be empty.
     * @param dimension The embedding dimensionality.
     * @param seed      Seed for the power iteration start vectors.
     * @return The fitted basis.
     * @throws IllegalArgumentException if there are no samples or a sample has the wrong dimension.
     */
    public static PcaProjectionBasis fit(final List<float[]> samples, final int dimension, final long seed) {
        if (dimension <= 3) {
            throw new IllegalArgumentException("Projection dimension must be greater than 3, got " + dimension);
        }
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("At least one sample is required to fit a PCA basis");
        }

        final int n = samples.size();
        final double[] mean = new double[dimension];
        for (final float[] sample : samples) {
            LinearAlgebra.requireDimension(sample, dimension);
            for (int i = 0; i < dimension; i++) {
                mean[i] += sample[i];
            }
        }
        LinearAlgebra.scale(mean, 1.0 / n);

        final double[][] centered = new double[n][dimension];
        for (int s = 0; s < n; s++) {
            final float[] sample = samples.get(s);
            for (int i = 0; i < dimension; i++) {
                centered[s][i] = sample[i] - mean[i];
            }
        }

        final Random random = new Random(seed);
        final double[][] components = new double[3][];
        final double[] variances = new double[3];
        for (int k = 0; k < 3; k++) {
            final double[] start = new double[dimension];
            for (int i = 0; i < dimension; i++) {
                start[i] = random.nextGaussian();
            }
            LinearAlgebra.orthogonalize(start, components, k);
            LinearAlgebra.scale(start, 1.0 / LinearAlgebra.norm(start));

            double[] v = start;
            double eigenvalue = 0.0;
            for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
                final double[] w = covarianceTimes(centered, v);
                LinearAlgebra.orthogonalize(w, components, k);
                final double norm = LinearAlgebra.norm(w);
                if (norm < ZERO_VARIANCE) {
                    eigenvalue = 0.0;
                    break;
                }
                LinearAlgebra.scale(w, 1.0 / norm);
                eigenvalue = norm;
                final double alignment = Math.abs(LinearAlgebra.dot(w, v));
                v = w;
                if (1.0 - alignment < CONVERGENCE) {
                    break;
                }
            }
            normalizeSign(v);
            components[k] = v;
            variances[k] = eigenvalue;
        }
        return new PcaProjectionBasis(dimension, mean, components, variances);
    }

    private static double[] covarianceTimes(final double[][] centered, final double[] v) {
        final double[] result = new double[v.length];
        for (final double[] row : centered) {
            final double weight = LinearAlgebra.dot(row, v);
            for (int i = 0; i < result.length; i++) {
                result[i] += weight * row[i];
            }
        }
        LinearAlgebra.scale(result, 1.0 / centered.length);
        return result;
    }

    private static void normalizeSign(final double[] v) {
        int largest = 0;
        for (int i = 1; i < v.length; i++) {
            if (Math.abs(v[i]) > Math.abs(v[largest])) {
                largest = i;
            }
        }
        if (v[largest] < 0) {
            LinearAlgebra.scale(v, -1.0);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] project(final float[] vector) {
        LinearAlgebra.requireDimension(vector, dimension);
        final double[] result = new double[3];
        for (int k = 0; k < 3; k++) {
            double sum = 0.0;
            for (int i = 0; i < dimension; i++) {
                sum += (vector[i] - mean[i]) * components[k][i];
            }
            result[k] = sum;
        }
        return result;
    }

    @Override
    public String type() {
        return TYPE;
    }

    /**
     * @return The variance captured by each component, largest first.
     */
    public double[] explainedVariance() {
        return variances.clone();
    }

    /**
     * @param index Component index, 0 to 2.
     * @return A copy of the unit-length component.
     */
    public double[] component(final int index) {
        return components[index].clone();
    }
}
