package de.leipzig.htwk.gitrdf.fixstrategy.service.recommendation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.RecommendationFeedback;
import de.leipzig.htwk.gitrdf.fixstrategy.model.SimilarAttempt;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyRecommendation;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyRecommendation.StrategyAlternative;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyScore;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import de.leipzig.htwk.gitrdf.fixstrategy.repository.AttemptStore;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.HashingTfIdfEmbedder;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedder;
import lombok.extern.slf4j.Slf4j;

/**
 * Recommends the fixing strategy that worked best on similar past issues.
 *
 * Pipeline: embed the issue, retrieve similar attempts of the same type, weight the
 * successful ones by similarity and historical confidence, rank strategy keys, gate on
 * evidence and confidence, explain the winner.
 */
@Service
@Slf4j
public class StrategyRecommender {

    public static final double MIN_SIMILARITY_THRESHOLD = 0.3;
    public static final int MIN_SAMPLE_SIZE = 2;
    public static final int DEFAULT_K = 10;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.4;
    public static final int MAX_ALTERNATIVES = 3;

    // Weight of a perfect match (similarity 1) recorded with confidence 1
    static final double MAX_ATTEMPT_WEIGHT = 2.0 * StrategyScore.sigmoid(2.5);

    private final AttemptStore attemptStore;
    private final IssueEmbedder embedder;

    public StrategyRecommender(AttemptStore attemptStore, IssueEmbedder embedder) {
        this.attemptStore = attemptStore;
        if (embedder == null) {
            log.warn("No embedder supplied to the strategy recommender, using statistical fallback");
            this.embedder = new HashingTfIdfEmbedder();
        } else {
            this.embedder = embedder;
        }
    }

    public Optional<StrategyRecommendation> recommend(Issue issue) {
        return recommend(issue, DEFAULT_K, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * @param k             number of similar attempts to consider, must be positive
     * @param minConfidence gate in [0, 1]; weaker recommendations are withheld
     * @return the best strategy, or empty when the history does not support one
     */
    public Optional<StrategyRecommendation> recommend(Issue issue, int k, double minConfidence) {
        if (issue == null) {
            throw new IllegalArgumentException("Issue must not be null");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive but was " + k);
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be in [0, 1] but was " + minConfidence);
        }

        EmbeddingVector embedding = embedder.embed(issue);
        List<SimilarAttempt> similar = attemptStore.findSimilar(embedding, issue.type(), k, MIN_SIMILARITY_THRESHOLD);

        List<SimilarAttempt> successes = similar.stream()
            .filter(match -> match.attempt().success())
            .collect(Collectors.toList());

        if (successes.size() < MIN_SAMPLE_SIZE) {
            log.info("InsufficientEvidence: {} successful similar attempts for {} issue (need {})",
                    successes.size(), issue.type(), MIN_SAMPLE_SIZE);
            return Optional.empty();
        }

        Map<String, Evidence> evidenceByKey = new LinkedHashMap<>();
        for (SimilarAttempt match : successes) {
            double weight = StrategyScore.similarityWeight(match.similarity()) * (1.0 + match.attempt().confidence());
            evidenceByKey.computeIfAbsent(match.attempt().strategyKey(), key -> new Evidence())
                .add(weight, match.similarity());
        }

        List<StrategyScore> ranking = evidenceByKey.entrySet().stream()
            .map(entry -> new StrategyScore(entry.getKey(), entry.getValue().weight))
            .sorted(StrategyScore.RANKING)
            .collect(Collectors.toList());

        StrategyScore best = ranking.get(0);
        Evidence bestEvidence = evidenceByKey.get(best.agentStrategy());

        long attemptsForKey = similar.stream()
            .filter(match -> match.attempt().strategyKey().equals(best.agentStrategy()))
            .count();
        int sampleCount = bestEvidence.count;
        double successRate = (double) sampleCount / attemptsForKey;
        double avgSimilarity = bestEvidence.similaritySum / sampleCount;
        double confidence = calculateConfidence(best.score(), sampleCount, avgSimilarity);

        if (confidence < minConfidence) {
            log.info("LowConfidence: best strategy {} reached {} (threshold {})",
                    best.agentStrategy(), String.format("%.3f", confidence), minConfidence);
            return Optional.empty();
        }

        List<StrategyAlternative> alternatives = ranking.stream()
            .skip(1)
            .limit(MAX_ALTERNATIVES)
            .map(score -> new StrategyAlternative(score.agentStrategy(), score.score()))
            .collect(Collectors.toList());

        String[] keyParts = splitStrategyKey(best.agentStrategy());

        StrategyRecommendation recommendation = StrategyRecommendation.builder()
            .agentStrategy(best.agentStrategy())
            .agentUsed(keyParts[0])
            .strategy(keyParts[1])
            .confidence(confidence)
            .similarityScore(avgSimilarity)
            .successRate(successRate)
            .sampleCount(sampleCount)
            .alternatives(alternatives)
            .reasoning(buildReasoning(keyParts[0], keyParts[1], sampleCount, successRate, avgSimilarity))
            .build();

        log.info("Recommended {} for {} issue (confidence {}, {} samples)", best.agentStrategy(), issue.type(),
                String.format("%.3f", confidence), sampleCount);
        return Optional.of(recommendation);
    }

    /**
     * Record whether a recommendation was acted upon.
     *
     * @return {@code true} when the feedback was persisted
     */
    public boolean trackFeedback(StrategyRecommendation recommendation, boolean accepted, Issue issue, String sessionId) {
        log.info("Recommendation {} {} for {} issue", recommendation.getAgentStrategy(),
                accepted ? "accepted" : "rejected", issue != null ? issue.type() : "unknown");

        return attemptStore.recordFeedback(new RecommendationFeedback(
            recommendation.getAgentStrategy(),
            accepted,
            recommendation.getConfidence(),
            issue != null ? issue.type() : null,
            sessionId,
            Instant.now()));
    }

    public IssueEmbedder getEmbedder() {
        return embedder;
    }

    static double calculateConfidence(double score, int sampleCount, double avgSimilarity) {
        double normalized = score / (sampleCount * MAX_ATTEMPT_WEIGHT);
        double sampleBonus = Math.min(0.1, 0.03 * Math.log(sampleCount));
        double confidence = 0.6 * normalized + 0.3 * avgSimilarity + sampleBonus;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static String[] splitStrategyKey(String agentStrategy) {
        int separator = agentStrategy.indexOf(':');
        if (separator < 0) {
            return new String[] {agentStrategy, ""};
        }
        return new String[] {agentStrategy.substring(0, separator), agentStrategy.substring(separator + 1)};
    }

    private static String buildReasoning(String agent, String strategy, int sampleCount,
                                         double successRate, double avgSimilarity) {
        return String.format(
            "%s using strategy '%s' fixed %d similar issue%s (success rate %.0f%%, average similarity %.2f).",
            agent, strategy, sampleCount, sampleCount == 1 ? "" : "s", successRate * 100, avgSimilarity);
    }

    private static final class Evidence {
        private double weight;
        private double similaritySum;
        private int count;

        void add(double attemptWeight, double similarity) {
            weight += attemptWeight;
            similaritySum += similarity;
            count++;
        }
    }
}
