package de.leipzig.htwk.gitrdf.fixstrategy.model.embedding;

/**
 * Embedding of an issue. Exactly one of the two representations, never a bare array.
 * Vectors are only comparable with vectors of the same kind.
 */
public sealed interface EmbeddingVector permits DenseVector, SparseVector {

    EmbeddingKind kind();

    /**
     * Declared width of the feature space (384 for dense, at most 100 for sparse)
     */
    int dimensions();

    /**
     * Euclidean norm, 0.0 for an all-zero vector
     */
    double norm();
}
