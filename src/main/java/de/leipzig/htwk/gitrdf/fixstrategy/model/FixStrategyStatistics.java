package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.util.List;

/**
 * Overall numbers about the attempt log.
 * {@code topStrategies} comes from the effectiveness summary and is only as fresh as its last rebuild.
 */
public record FixStrategyStatistics(
    long totalAttempts,
    long successfulAttempts,
    double overallSuccessRate,
    List<StrategyEffectivenessSummary> topStrategies
) {

    public static FixStrategyStatistics empty() {
        return new FixStrategyStatistics(0, 0, 0.0, List.of());
    }
}
