package de.leipzig.htwk.gitrdf.fixstrategy.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import de.leipzig.htwk.gitrdf.fixstrategy.model.FixResult;
import de.leipzig.htwk.gitrdf.fixstrategy.model.FixStrategyStatistics;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Requests.FeedbackRequest;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Requests.RecommendRequest;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Requests.RecordAttemptRequest;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyEffectivenessSummary;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyRecommendation;
import de.leipzig.htwk.gitrdf.fixstrategy.service.FixAttemptService;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedder;
import de.leipzig.htwk.gitrdf.fixstrategy.service.recommendation.StrategyRecommender;
import de.leipzig.htwk.gitrdf.fixstrategy.validation.RequestValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Controller that lets the orchestrator record fix outcomes and ask for strategy recommendations
 */
@RestController
@RequestMapping("/api/v1/fix-strategy")
@RequiredArgsConstructor
@Slf4j
public class FixStrategyController {

    private final FixAttemptService fixAttemptService;
    private final StrategyRecommender strategyRecommender;
    private final IssueEmbedder issueEmbedder;

    /**
     * Record the outcome of one fix attempt
     */
    @PostMapping("/attempts")
    public ResponseEntity<Map<String, Object>> recordAttempt(@Valid @RequestBody RecordAttemptRequest request) {
        RequestValidator.validateIssueType(request.getIssue().getType(), "issue.type");
        RequestValidator.validateConfidence(request.getConfidence(), "confidence");

        Issue issue = request.getIssue().toIssue();
        FixResult result = new FixResult(request.getSuccess(),
            request.getConfidence() != null ? request.getConfidence() : 0.0);

        boolean stored = fixAttemptService.recordAttempt(issue, result,
            request.getAgentUsed(), request.getStrategy(), request.getSessionId());

        return ResponseEntity.ok(Map.of(
            "success", stored,
            "stored", stored
        ));
    }

    /**
     * Recommend a strategy for an issue based on similar past attempts
     */
    @PostMapping("/recommendations")
    public ResponseEntity<Map<String, Object>> recommend(@Valid @RequestBody RecommendRequest request) {
        RequestValidator.validateIssueType(request.getIssue().getType(), "issue.type");
        RequestValidator.validateK(request.getK(), "k");
        RequestValidator.validateConfidence(request.getMinConfidence(), "minConfidence");

        int k = request.getK() != null ? request.getK() : StrategyRecommender.DEFAULT_K;
        double minConfidence = request.getMinConfidence() != null
            ? request.getMinConfidence()
            : StrategyRecommender.DEFAULT_MIN_CONFIDENCE;

        Optional<StrategyRecommendation> recommendation =
            strategyRecommender.recommend(request.getIssue().toIssue(), k, minConfidence);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("recommended", recommendation.isPresent());
        recommendation.ifPresent(value -> response.put("recommendation", value));
        if (recommendation.isEmpty()) {
            response.put("message", "Not enough similar successful attempts for a confident recommendation");
        }
        return ResponseEntity.ok(response);
    }

    /**
     * Report whether a recommendation was accepted
     */
    @PostMapping("/feedback")
    public ResponseEntity<Map<String, Object>> feedback(@Valid @RequestBody FeedbackRequest request) {
        RequestValidator.validateStrategyKey(request.getAgentStrategy(), "agentStrategy");
        RequestValidator.validateConfidence(request.getConfidence(), "confidence");
        Issue issue = null;
        if (request.getIssueType() != null) {
            RequestValidator.validateIssueType(request.getIssueType(), "issueType");
            issue = new Issue(IssueType.fromString(request.getIssueType()), "", null, "");
        }

        StrategyRecommendation recommendation = StrategyRecommendation.builder()
            .agentStrategy(request.getAgentStrategy())
            .confidence(request.getConfidence() != null ? request.getConfidence() : 0.0)
            .build();

        boolean stored = strategyRecommender.trackFeedback(recommendation, request.getAccepted(), issue,
            request.getSessionId());

        return ResponseEntity.ok(Map.of(
            "success", stored,
            "stored", stored
        ));
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> statistics() {
        FixStrategyStatistics statistics = fixAttemptService.statistics();
        return ResponseEntity.ok(Map.of(
            "success", true,
            "totalAttempts", statistics.totalAttempts(),
            "successfulAttempts", statistics.successfulAttempts(),
            "overallSuccessRate", statistics.overallSuccessRate(),
            "topStrategies", statistics.topStrategies()
        ));
    }

    @GetMapping("/effectiveness")
    public ResponseEntity<Map<String, Object>> effectiveness() {
        List<StrategyEffectivenessSummary> summary = fixAttemptService.effectivenessSummary();
        return ResponseEntity.ok(Map.of(
            "success", true,
            "count", summary.size(),
            "strategies", summary
        ));
    }

    /**
     * Recompute the effectiveness summary from the attempt log
     */
    @PostMapping("/effectiveness/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildEffectiveness() {
        fixAttemptService.rebuildEffectivenessSummary();
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping("/embedder")
    public ResponseEntity<Map<String, Object>> embedder() {
        return ResponseEntity.ok(Map.of(
            "neuralAvailable", issueEmbedder.isNeuralAvailable(),
            "kind", issueEmbedder.kind().getValue(),
            "description", issueEmbedder.kind().getDescription(),
            "dimensions", issueEmbedder.dimensions()
        ));
    }
}
