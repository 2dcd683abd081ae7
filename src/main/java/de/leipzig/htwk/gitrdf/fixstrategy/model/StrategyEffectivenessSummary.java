package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.time.Instant;

/**
 * Aggregate of all attempts for one "agent:strategy" key.
 * Derived from the attempt log, safe to drop and rebuild.
 */
public record StrategyEffectivenessSummary(
    String agentStrategy,
    int totalAttempts,
    int successfulAttempts,
    double successRate,
    Instant lastAttempted,
    Instant lastSuccessful
) {
}
