package de.leipzig.htwk.gitrdf.fixstrategy.model.embedding;

import java.util.Arrays;

/**
 * Sparse vector in a fixed, bounded feature space.
 * Indices are strictly ascending and smaller than {@code width}.
 */
public record SparseVector(int width, int[] indices, float[] values) implements EmbeddingVector {

    public static final int MAX_WIDTH = 100;

    public SparseVector {
        if (width <= 0 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("Sparse width must be in 1.." + MAX_WIDTH + " but was " + width);
        }
        if (indices == null || values == null || indices.length != values.length) {
            throw new IllegalArgumentException("Sparse indices and values must have the same length");
        }
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= width) {
                throw new IllegalArgumentException("Sparse index " + indices[i] + " outside width " + width);
            }
            if (i > 0 && indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("Sparse indices must be strictly ascending");
            }
        }
        indices = indices.clone();
        values = values.clone();
    }

    public static SparseVector empty(int width) {
        return new SparseVector(width, new int[0], new float[0]);
    }

    @Override
    public int[] indices() {
        return indices.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    /**
     * Number of stored (non-zero) entries
     */
    public int nonZeroCount() {
        return indices.length;
    }

    public int indexAt(int position) {
        return indices[position];
    }

    public float valueAt(int position) {
        return values[position];
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.SPARSE;
    }

    @Override
    public int dimensions() {
        return width;
    }

    @Override
    public double norm() {
        double sum = 0.0;
        for (float value : values) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SparseVector sparse
            && width == sparse.width
            && Arrays.equals(indices, sparse.indices)
            && Arrays.equals(values, sparse.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + Arrays.hashCode(indices)) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SparseVector[width=" + width + ", nonZero=" + indices.length + "]";
    }
}
