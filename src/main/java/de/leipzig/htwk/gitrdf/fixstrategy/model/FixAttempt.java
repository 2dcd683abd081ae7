package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.time.Instant;

import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import lombok.Builder;

/**
 * One historical fix attempt read back from the attempt log.
 * Instances are copies; the log itself is append-only.
 */
@Builder
public record FixAttempt(
    Long id,
    IssueType issueType,
    String issueMessage,
    String filePath,
    String stage,
    EmbeddingVector embedding,
    String agentUsed,
    String strategy,
    boolean success,
    double confidence,
    Instant timestamp,
    String sessionId
) {

    public static String strategyKey(String agentUsed, String strategy) {
        return agentUsed + ":" + strategy;
    }

    public String strategyKey() {
        return strategyKey(agentUsed, strategy);
    }
}
