package de.leipzig.htwk.gitrdf.fixstrategy.service.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.leipzig.htwk.gitrdf.fixstrategy.model.FixResult;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyRecommendation;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyRecommendation.StrategyAlternative;
import de.leipzig.htwk.gitrdf.fixstrategy.repository.AttemptStore;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.HashingTfIdfEmbedder;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedder;

@DisplayName("Strategy recommender")
class StrategyRecommenderTest {

    private static final Issue COMPLEX_FUNCTION = new Issue(IssueType.COMPLEXITY,
        "Function parse_config has cognitive complexity 27 (threshold 15)", "crackerjack/config.py", 88, "complexipy");

    @TempDir
    Path tempDir;

    private AttemptStore store;
    private IssueEmbedder embedder;
    private StrategyRecommender recommender;

    @BeforeEach
    void setUp() {
        store = new AttemptStore(tempDir.resolve("recommender.db"));
        embedder = new HashingTfIdfEmbedder();
        recommender = new StrategyRecommender(store, embedder);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Empty history gives no recommendation")
    void emptyStoreGivesNothing() {
        assertThat(recommender.recommend(COMPLEX_FUNCTION)).isEmpty();
    }

    @Test
    @DisplayName("Three matching successes recommend their strategy")
    void threeSuccessesRecommendStrategy() {
        // Given
        for (int i = 0; i < 3; i++) {
            record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.9);
        }

        // When
        Optional<StrategyRecommendation> recommendation = recommender.recommend(COMPLEX_FUNCTION);

        // Then
        assertThat(recommendation).isPresent();
        StrategyRecommendation result = recommendation.get();
        assertThat(result.getAgentStrategy()).isEqualTo("RefactoringAgent:extract_method");
        assertThat(result.getAgentUsed()).isEqualTo("RefactoringAgent");
        assertThat(result.getStrategy()).isEqualTo("extract_method");
        assertThat(result.getSuccessRate()).isEqualTo(1.0);
        assertThat(result.getSampleCount()).isEqualTo(3);
        assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.4).isLessThanOrEqualTo(1.0);
        assertThat(result.getConfidence()).isCloseTo(0.903, within(0.01));
        assertThat(result.getSimilarityScore()).isCloseTo(1.0, within(1e-5));
        assertThat(result.getAlternatives()).isEmpty();
        assertThat(result.getReasoning()).contains("RefactoringAgent").contains("extract_method").contains("3 similar issues");
    }

    @Test
    @DisplayName("A single success is not enough evidence")
    void singleSuccessIsInsufficient() {
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.9);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", false, 0.3);

        assertThat(recommender.recommend(COMPLEX_FUNCTION)).isEmpty();
    }

    @Test
    @DisplayName("Tied strategies resolve to the lexicographically smallest key, whatever the insertion order")
    void tieBreakIsLexicographic() {
        // Given: identical evidence for both keys, the later key inserted first
        record(COMPLEX_FUNCTION, "RefactoringAgent", "split_function", true, 0.8);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "split_function", true, 0.8);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.8);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.8);

        // When
        Optional<StrategyRecommendation> recommendation = recommender.recommend(COMPLEX_FUNCTION);

        // Then
        assertThat(recommendation).map(StrategyRecommendation::getAgentStrategy)
            .contains("RefactoringAgent:extract_method");
        assertThat(recommendation.get().getAlternatives())
            .extracting(StrategyAlternative::agentStrategy)
            .containsExactly("RefactoringAgent:split_function");
    }

    @Test
    @DisplayName("Success rate counts the failures of the winning strategy")
    void successRateIncludesFailures() {
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.9);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.9);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", false, 0.2);

        Optional<StrategyRecommendation> recommendation = recommender.recommend(COMPLEX_FUNCTION);

        assertThat(recommendation).isPresent();
        assertThat(recommendation.get().getSampleCount()).isEqualTo(2);
        assertThat(recommendation.get().getSuccessRate()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("At most three alternatives, ordered by accumulated weight")
    void alternativesAreCapped() {
        // Given
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 1.0);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 1.0);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 1.0);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "split_function", true, 1.0);
        record(COMPLEX_FUNCTION, "RefactoringAgent", "split_function", true, 1.0);
        record(COMPLEX_FUNCTION, "ArchitectAgent", "introduce_class", true, 0.5);
        record(COMPLEX_FUNCTION, "DryAgent", "deduplicate", true, 0.2);
        record(COMPLEX_FUNCTION, "PerformanceAgent", "inline", true, 0.1);

        // When
        StrategyRecommendation recommendation = recommender.recommend(COMPLEX_FUNCTION).orElseThrow();

        // Then
        assertThat(recommendation.getAgentStrategy()).isEqualTo("RefactoringAgent:extract_method");
        assertThat(recommendation.getAlternatives())
            .extracting(StrategyAlternative::agentStrategy)
            .containsExactly("RefactoringAgent:split_function", "ArchitectAgent:introduce_class", "DryAgent:deduplicate");
    }

    @Test
    @DisplayName("Recommendations below the confidence gate are withheld")
    void lowConfidenceIsWithheld() {
        for (int i = 0; i < 3; i++) {
            record(COMPLEX_FUNCTION, "RefactoringAgent", "extract_method", true, 0.9);
        }

        assertThat(recommender.recommend(COMPLEX_FUNCTION, 10, 0.99)).isEmpty();
        assertThat(recommender.recommend(COMPLEX_FUNCTION, 10, 0.0)).isPresent();
    }

    @Test
    @DisplayName("Attempts for other issue types are not evidence")
    void otherIssueTypesAreIgnored() {
        Issue sameTextOtherType = new Issue(IssueType.PERFORMANCE, COMPLEX_FUNCTION.message(),
            COMPLEX_FUNCTION.filePath(), COMPLEX_FUNCTION.lineNumber(), COMPLEX_FUNCTION.stage());
        record(sameTextOtherType, "RefactoringAgent", "extract_method", true, 0.9);
        record(sameTextOtherType, "RefactoringAgent", "extract_method", true, 0.9);

        assertThat(recommender.recommend(COMPLEX_FUNCTION)).isEmpty();
    }

    @Test
    @DisplayName("Invalid k or confidence gate is rejected")
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> recommender.recommend(COMPLEX_FUNCTION, 0, 0.4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recommender.recommend(COMPLEX_FUNCTION, 10, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A missing embedder is replaced by the statistical fallback")
    void nullEmbedderFallsBack() {
        StrategyRecommender withoutEmbedder = new StrategyRecommender(store, null);

        assertThat(withoutEmbedder.getEmbedder()).isInstanceOf(HashingTfIdfEmbedder.class);
        assertThat(withoutEmbedder.recommend(COMPLEX_FUNCTION)).isEmpty();
    }

    @Test
    @DisplayName("Feedback on a recommendation is persisted")
    void feedbackIsPersisted() {
        StrategyRecommendation recommendation = StrategyRecommendation.builder()
            .agentStrategy("RefactoringAgent:extract_method")
            .confidence(0.9)
            .build();

        assertThat(recommender.trackFeedback(recommendation, true, COMPLEX_FUNCTION, "session-1")).isTrue();
        assertThat(store.feedbackCount("RefactoringAgent:extract_method")).isEqualTo(1);
    }

    @Test
    @DisplayName("Confidence formula for perfect evidence")
    void confidenceFormula() {
        double perfectWeight = StrategyRecommender.MAX_ATTEMPT_WEIGHT;

        double confidence = StrategyRecommender.calculateConfidence(3 * perfectWeight, 3, 1.0);

        assertThat(confidence).isCloseTo(0.6 + 0.3 + 0.03 * Math.log(3), within(1e-9));
        assertThat(StrategyRecommender.calculateConfidence(100 * perfectWeight, 100, 1.0)).isCloseTo(1.0, within(1e-9));
    }

    private void record(Issue issue, String agent, String strategy, boolean success, double confidence) {
        assertThat(store.record(issue, new FixResult(success, confidence), agent, strategy, embedder.embed(issue), "test"))
            .isTrue();
    }
}
