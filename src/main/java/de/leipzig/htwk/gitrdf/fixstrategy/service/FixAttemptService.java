package de.leipzig.htwk.gitrdf.fixstrategy.service;

import java.util.List;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.fixstrategy.model.FixResult;
import de.leipzig.htwk.gitrdf.fixstrategy.model.FixStrategyStatistics;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyEffectivenessSummary;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import de.leipzig.htwk.gitrdf.fixstrategy.repository.AttemptStore;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records fix outcomes for callers that only hold the issue, embedding it with the
 * process-wide embedder.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FixAttemptService {

    private final AttemptStore attemptStore;
    private final IssueEmbedder issueEmbedder;

    public boolean recordAttempt(Issue issue, FixResult result, String agentUsed, String strategy, String sessionId) {
        EmbeddingVector embedding = issueEmbedder.embed(issue);
        boolean stored = attemptStore.record(issue, result, agentUsed, strategy, embedding, sessionId);
        if (stored) {
            log.info("Stored {} attempt of {}:{} for {} issue", result.success() ? "successful" : "failed",
                    agentUsed, strategy, issue.type());
        }
        return stored;
    }

    public FixStrategyStatistics statistics() {
        return attemptStore.statistics();
    }

    public List<StrategyEffectivenessSummary> effectivenessSummary() {
        return attemptStore.effectivenessSummary();
    }

    public void rebuildEffectivenessSummary() {
        attemptStore.rebuildEffectivenessSummary();
    }
}
