package com.recommender.core;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse, immutable weight vector. Dimensions are stored in ascending order.
 */
public final class FeatureVector {

    public static final FeatureVector ZERO = new FeatureVector(new int[0], new double[0]);

    private final int[] dimensions;
    private final double[] weights;

    private FeatureVector(int[] dimensions, double[] weights) {
        this.dimensions = dimensions;
        this.weights = weights;
    }

    /**
     * Builds a vector from a dimension -> weight mapping. Zero weights are skipped.
     */
    public static FeatureVector of(Map<Integer, Double> entries) {
        if (entries == null || entries.isEmpty()) return ZERO;

        TreeMap<Integer, Double> sorted = new TreeMap<>(entries);
        int[] dims = new int[sorted.size()];
        double[] ws = new double[sorted.size()];
        int n = 0;
        for (Map.Entry<Integer, Double> e : sorted.entrySet()) {
            double w = e.getValue() == null ? 0.0 : e.getValue();
            if (e.getKey() < 0) {
                throw new IllegalArgumentException("negative dimension: " + e.getKey());
            }
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("invalid weight " + w + " at dimension " + e.getKey());
            }
            if (w == 0.0) continue;
            dims[n] = e.getKey();
            ws[n] = w;
            n++;
        }
        if (n == 0) return ZERO;
        return new FeatureVector(Arrays.copyOf(dims, n), Arrays.copyOf(ws, n));
    }

    public double norm() {
        double sum = 0.0;
        for (double w : weights) {
            sum += w * w;
        }
        return Math.sqrt(sum);
    }

    /**
     * Divides every weight by the Euclidean norm. A zero vector stays zero.
     */
    public FeatureVector normalized() {
        double norm = norm();
        if (norm == 0.0) return ZERO;

        double[] ws = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            ws[i] = weights[i] / norm;
        }
        return new FeatureVector(dimensions, ws);
    }

    public boolean isZero() {
        return dimensions.length == 0;
    }

    public int nonZeroCount() {
        return dimensions.length;
    }

    public double weight(int dimension) {
        int i = Arrays.binarySearch(dimensions, dimension);
        return i >= 0 ? weights[i] : 0.0;
    }

    public double dot(FeatureVector other) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < dimensions.length && j < other.dimensions.length) {
            int a = dimensions[i];
            int b = other.dimensions[j];
            if (a == b) {
                sum += weights[i] * other.weights[j];
                i++;
                j++;
            } else if (a < b) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    /**
     * Dot product against a dense array. Dimensions beyond the array length count as zero.
     */
    public double dot(double[] dense) {
        double sum = 0.0;
        for (int i = 0; i < dimensions.length; i++) {
            int d = dimensions[i];
            if (d >= dense.length) break;
            sum += weights[i] * dense[d];
        }
        return sum;
    }

    public double[] toDense(int dimension) {
        double[] out = new double[dimension];
        for (int i = 0; i < dimensions.length; i++) {
            int d = dimensions[i];
            if (d >= dimension) {
                throw new IllegalArgumentException("dimension " + d + " outside dense size " + dimension);
            }
            out[d] = weights[i];
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return Arrays.equals(dimensions, other.dimensions) && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < dimensions.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(dimensions[i]).append('=').append(weights[i]);
        }
        return sb.append('}').toString();
    }
}
