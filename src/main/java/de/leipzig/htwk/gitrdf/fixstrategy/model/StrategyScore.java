package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.util.Comparator;

/**
 * Accumulated evidence weight of one strategy key.
 */
public record StrategyScore(String agentStrategy, double score) {

    /**
     * Highest score first; equal scores are ordered by strategy key so the winner
     * does not depend on the order in which evidence was read.
     */
    public static final Comparator<StrategyScore> RANKING = Comparator
        .comparingDouble(StrategyScore::score).reversed()
        .thenComparing(StrategyScore::agentStrategy);

    /**
     * Evidence weight of one successful attempt by similarity alone: {@code sigmoid(5 * (s - 0.5))}.
     */
    public static double similarityWeight(double similarity) {
        return sigmoid(5.0 * (similarity - 0.5));
    }

    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
