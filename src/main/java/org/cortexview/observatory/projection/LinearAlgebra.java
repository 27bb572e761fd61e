package org.cortexview.observatory.projection;

/**
 * Small dense vector helpers shared by the projection bases.
 */
final class LinearAlgebra {

    private LinearAlgebra() {
    }

    static void requireDimension(final float[] vector, final int dimension) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("Expected a vector of dimension " + dimension
                + ", got " + (vector == null ? "null" : vector.length));
        }
    }

    static double dot(final double[] a, final float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double dot(final double[] a, final double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double norm(final double[] a) {
        return Math.sqrt(dot(a, a));
    }

    static void scale(final double[] a, final double factor) {
        for (int i = 0; i < a.length; i++) {
            a[i] *= factor;
        }
    }

    /**
     * Removes from {@code v} its components along each of the given orthonormal vectors.
     */
    static void orthogonalize(final double[] v, final double[][] basis, final int count) {
        for (int k = 0; k < count; k++) {
            final double projection = dot(v, basis[k]);
            for (int i = 0; i < v.length; i++) {
                v[i] -= projection * basis[k][i];
            }
        }
    }
}
