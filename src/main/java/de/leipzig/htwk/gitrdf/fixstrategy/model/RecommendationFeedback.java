package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.time.Instant;

/**
 * Whether a recommendation was acted upon by a human or the orchestrator.
 */
public record RecommendationFeedback(
    String agentStrategy,
    boolean accepted,
    double confidence,
    IssueType issueType,
    String sessionId,
    Instant timestamp
) {
}
