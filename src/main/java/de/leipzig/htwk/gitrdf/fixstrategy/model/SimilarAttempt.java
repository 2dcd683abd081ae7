package de.leipzig.htwk.gitrdf.fixstrategy.model;

/**
 * A stored attempt together with its cosine similarity to the query embedding.
 */
public record SimilarAttempt(FixAttempt attempt, double similarity) {
}
