package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import de.leipzig.htwk.gitrdf.fixstrategy.exception.EmbeddingVariantMismatchException;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.DenseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.SparseVector;

/**
 * Cosine similarity over both embedding kinds.
 */
public final class EmbeddingSimilarity {

    private EmbeddingSimilarity() {
    }

    /**
     * True when both vectors live in the same feature space (same kind and width)
     */
    public static boolean comparable(EmbeddingVector a, EmbeddingVector b) {
        return a != null && b != null
            && a.kind() == b.kind()
            && a.dimensions() == b.dimensions();
    }

    /**
     * Cosine similarity in [-1, 1], 0.0 when either vector has zero norm
     */
    public static double cosine(EmbeddingVector a, EmbeddingVector b) {
        if (!comparable(a, b)) {
            throw new EmbeddingVariantMismatchException(a, b);
        }

        double normA = a.norm();
        double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double dotProduct;
        if (a instanceof DenseVector denseA && b instanceof DenseVector denseB) {
            dotProduct = dot(denseA, denseB);
        } else if (a instanceof SparseVector sparseA && b instanceof SparseVector sparseB) {
            dotProduct = dot(sparseA, sparseB);
        } else {
            throw new EmbeddingVariantMismatchException(a, b);
        }

        double similarity = dotProduct / (normA * normB);
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    private static double dot(DenseVector a, DenseVector b) {
        double sum = 0.0;
        for (int i = 0; i < a.dimensions(); i++) {
            sum += (double) a.get(i) * b.get(i);
        }
        return sum;
    }

    // Merge walk over the ascending index arrays
    private static double dot(SparseVector a, SparseVector b) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < a.nonZeroCount() && j < b.nonZeroCount()) {
            int indexA = a.indexAt(i);
            int indexB = b.indexAt(j);
            if (indexA == indexB) {
                sum += (double) a.valueAt(i) * b.valueAt(j);
                i++;
                j++;
            } else if (indexA < indexB) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }
}
