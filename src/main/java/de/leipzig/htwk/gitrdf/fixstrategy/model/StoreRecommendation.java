package de.leipzig.htwk.gitrdf.fixstrategy.model;

/**
 * Minimal recommendation answered straight from the attempt log, without reasoning.
 */
public record StoreRecommendation(String agentStrategy, double confidence) {
}
