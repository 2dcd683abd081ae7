package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import java.util.ArrayList;
import java.util.List;

import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingKind;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;

/**
 * Turns issues into embedding vectors.
 *
 * Exactly one implementation is active per process. Implementations never throw from
 * {@link #embed(Issue)} or {@link #embedBatch(List)}: a failing encoder degrades to a
 * zero vector of its own kind.
 */
public interface IssueEmbedder {

    /**
     * Embed the salient fields of an issue (type, stage, message, file, line)
     */
    default EmbeddingVector embed(Issue issue) {
        return embedText(IssueFeatureTextBuilder.buildFeatureText(issue));
    }

    /**
     * Embed arbitrary text, for records other than issues
     */
    EmbeddingVector embedText(String text);

    /**
     * Embed several issues, same order as the input. Empty input gives an empty list.
     */
    default List<EmbeddingVector> embedBatch(List<Issue> issues) {
        List<EmbeddingVector> embeddings = new ArrayList<>(issues.size());
        for (Issue issue : issues) {
            embeddings.add(embed(issue));
        }
        return embeddings;
    }

    /**
     * Cosine similarity of two vectors of this embedder's kind
     *
     * @throws de.leipzig.htwk.gitrdf.fixstrategy.exception.EmbeddingVariantMismatchException
     *         when the vectors come from different feature spaces
     */
    default double similarity(EmbeddingVector a, EmbeddingVector b) {
        return EmbeddingSimilarity.cosine(a, b);
    }

    /**
     * Whether vectors come from the neural encoder (dense) or the statistical fallback (sparse)
     */
    boolean isNeuralAvailable();

    EmbeddingKind kind();

    int dimensions();
}
