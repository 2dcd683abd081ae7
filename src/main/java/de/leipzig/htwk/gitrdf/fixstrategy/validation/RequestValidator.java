package de.leipzig.htwk.gitrdf.fixstrategy.validation;

import de.leipzig.htwk.gitrdf.fixstrategy.exception.RequestValidationException;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import de.leipzig.htwk.gitrdf.fixstrategy.service.recommendation.StrategyRecommender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Semantic checks on request values that bean validation cannot express
 */
@Component
@Slf4j
public class RequestValidator {

    /**
     * Validate an issue type name, suggesting the closest supported one
     */
    public static void validateIssueType(String issueType, String fieldName) {
        if (IssueType.isSupported(issueType)) {
            return;
        }

        String normalized = issueType == null ? "" : issueType.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        throw RequestValidationException.unsupportedIssueType(fieldName, issueType,
            findClosestMatch(normalized, IssueType.getAllValues()));
    }

    /**
     * Validate the neighbourhood size of a recommendation request
     */
    public static void validateK(Integer k, String fieldName) {
        if (k == null) return; // Optional parameter

        if (k <= 0) {
            throw RequestValidationException.outOfRange("recommendation validation", fieldName, k, "1 or greater",
                "Use 10 to consider the ten most similar past attempts", StrategyRecommender.DEFAULT_K);
        }
    }

    /**
     * Validate a confidence value or threshold in [0, 1]
     */
    public static void validateConfidence(Double confidence, String fieldName) {
        if (confidence == null) return; // Optional parameter

        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw RequestValidationException.outOfRange("confidence validation", fieldName, confidence, "0.0 to 1.0",
                "Use 0.3 for more recommendations or 0.7 for fewer, stronger ones",
                StrategyRecommender.DEFAULT_MIN_CONFIDENCE);
        }
    }

    /**
     * Validate that a strategy key has the form "agent:strategy"
     */
    public static void validateStrategyKey(String agentStrategy, String fieldName) {
        int separator = agentStrategy == null ? -1 : agentStrategy.indexOf(':');
        if (separator <= 0 || separator == agentStrategy.length() - 1) {
            throw RequestValidationException.malformedStrategyKey(fieldName, agentStrategy);
        }
    }

    /**
     * Find closest string match for suggestions
     */
    private static String findClosestMatch(String input, List<String> candidates) {
        return candidates.stream()
            .min((a, b) -> Integer.compare(
                levenshteinDistance(input, a),
                levenshteinDistance(input, b)
            ))
            .orElse(candidates.get(0));
    }

    private static int levenshteinDistance(String s1, String s2) {
        int[][] dp = new int[s1.length() + 1][s2.length() + 1];

        for (int i = 0; i <= s1.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= s2.length(); j++) dp[0][j] = j;

        for (int i = 1; i <= s1.length(); i++) {
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }

        return dp[s1.length()][s2.length()];
    }
}
