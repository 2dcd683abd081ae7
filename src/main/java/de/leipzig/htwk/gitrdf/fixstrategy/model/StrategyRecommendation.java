package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recommended fixing strategy for one issue, created fresh per request and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRecommendation {

    private String agentStrategy;
    private String agentUsed;
    private String strategy;

    // Calibrated [0, 1] estimate
    private double confidence;

    // Mean similarity of the supporting attempts
    private double similarityScore;

    private double successRate;
    private int sampleCount;

    @Builder.Default
    private List<StrategyAlternative> alternatives = List.of();

    private String reasoning;

    public record StrategyAlternative(String agentStrategy, double score) {
    }
}
