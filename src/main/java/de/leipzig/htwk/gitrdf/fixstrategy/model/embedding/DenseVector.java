package de.leipzig.htwk.gitrdf.fixstrategy.model.embedding;

import java.util.Arrays;

/**
 * Dense float vector as produced by the neural encoder.
 */
public record DenseVector(float[] values) implements EmbeddingVector {

    public DenseVector {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Dense vector needs at least one dimension");
        }
        values = values.clone();
    }

    public static DenseVector zeros(int dimensions) {
        return new DenseVector(new float[dimensions]);
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public float get(int index) {
        return values[index];
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.DENSE;
    }

    @Override
    public int dimensions() {
        return values.length;
    }

    @Override
    public double norm() {
        double sum = 0.0;
        for (float value : values) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    public boolean isZero() {
        for (float value : values) {
            if (value != 0.0f) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DenseVector dense && Arrays.equals(values, dense.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DenseVector[dimensions=" + values.length + "]";
    }
}
