package de.leipzig.htwk.gitrdf.fixstrategy.exception;

import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import lombok.Getter;

/**
 * Two embeddings from different feature spaces were compared.
 * This is a programming error, callers must filter by kind before comparing.
 */
@Getter
public class EmbeddingVariantMismatchException extends IllegalArgumentException {

    private final String left;
    private final String right;

    public EmbeddingVariantMismatchException(EmbeddingVector left, EmbeddingVector right) {
        super(String.format("Cannot compare %s with %s", left, right));
        this.left = String.valueOf(left);
        this.right = String.valueOf(right);
    }
}
