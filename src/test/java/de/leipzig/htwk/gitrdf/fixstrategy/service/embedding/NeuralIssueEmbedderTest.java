package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import de.leipzig.htwk.gitrdf.fixstrategy.config.EmbeddingServiceConfig;
import de.leipzig.htwk.gitrdf.fixstrategy.exception.EmbeddingServiceException;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.DenseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingKind;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;

@DisplayName("Neural issue embedder")
class NeuralIssueEmbedderTest {

    private static final String SERVICE_URL = "http://embeddings.test/v1/embeddings";

    private EmbeddingServiceConfig config;
    private MockRestServiceServer server;
    private NeuralIssueEmbedder embedder;

    @BeforeEach
    void setUp() {
        config = new EmbeddingServiceConfig();
        config.setServiceUrl(SERVICE_URL);
        config.setDimensions(4);
        config.setMaxRetries(2);
        config.setRetryBackoffMillis(0);
        config.setBatchSize(2);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        embedder = new NeuralIssueEmbedder(config, restTemplate);
    }

    @Test
    @DisplayName("Posts the feature text and returns the dense vector")
    void embedReturnsServiceVector() {
        // Given
        server.expect(requestTo(SERVICE_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.model").value("all-MiniLM-L6-v2"))
            .andExpect(jsonPath("$.dimensions").value(4))
            .andRespond(withSuccess("{\"data\":[{\"embedding\":[0.1,0.2,0.3,0.4],\"index\":0}]}",
                MediaType.APPLICATION_JSON));

        // When
        EmbeddingVector vector = embedder.embed(new Issue(IssueType.FORMATTING, "Line too long", "a.py", "ruff"));

        // Then
        server.verify();
        assertThat(vector).isEqualTo(new DenseVector(new float[] {0.1f, 0.2f, 0.3f, 0.4f}));
        assertThat(embedder.kind()).isEqualTo(EmbeddingKind.DENSE);
        assertThat(embedder.isNeuralAvailable()).isTrue();
    }

    @Test
    @DisplayName("Degrades to a zero vector after the retries are used up")
    void embedDegradesToZeroVector() {
        // Given
        server.expect(ExpectedCount.times(2), requestTo(SERVICE_URL)).andRespond(withServerError());

        // When
        EmbeddingVector vector = embedder.embedText("type: security | message: use of eval");

        // Then
        server.verify();
        assertThat(vector).isEqualTo(DenseVector.zeros(4));
    }

    @Test
    @DisplayName("A vector of the wrong width is treated as a failure")
    void wrongWidthDegrades() {
        server.expect(ExpectedCount.times(2), requestTo(SERVICE_URL))
            .andRespond(withSuccess("{\"data\":[{\"embedding\":[0.1,0.2],\"index\":0}]}", MediaType.APPLICATION_JSON));

        EmbeddingVector vector = embedder.embedText("type: formatting | message: trailing whitespace");

        server.verify();
        assertThat(((DenseVector) vector).isZero()).isTrue();
        assertThat(vector.dimensions()).isEqualTo(4);
    }

    @Test
    @DisplayName("Batch results follow the response index, not the response order")
    void batchIsOrderedByIndex() {
        // Given
        server.expect(requestTo(SERVICE_URL))
            .andRespond(withSuccess("{\"data\":["
                + "{\"embedding\":[0,1,0,0],\"index\":1},"
                + "{\"embedding\":[1,0,0,0],\"index\":0}]}", MediaType.APPLICATION_JSON));

        List<Issue> issues = List.of(
            new Issue(IssueType.IMPORT_ERROR, "No module named foo", "a.py", "pyright"),
            new Issue(IssueType.IMPORT_ERROR, "No module named bar", "b.py", "pyright"));

        // When
        List<EmbeddingVector> vectors = embedder.embedBatch(issues);

        // Then
        server.verify();
        assertThat(vectors).containsExactly(
            new DenseVector(new float[] {1f, 0f, 0f, 0f}),
            new DenseVector(new float[] {0f, 1f, 0f, 0f}));
    }

    @Test
    @DisplayName("A failed chunk degrades only its own items")
    void failedChunkDegradesOnlyItsItems() {
        // Given: batch size 2, three issues -> two requests
        server.expect(requestTo(SERVICE_URL))
            .andRespond(withSuccess("{\"data\":["
                + "{\"embedding\":[1,0,0,0],\"index\":0},"
                + "{\"embedding\":[0,1,0,0],\"index\":1}]}", MediaType.APPLICATION_JSON));
        server.expect(ExpectedCount.times(2), requestTo(SERVICE_URL)).andRespond(withServerError());

        List<Issue> issues = List.of(
            new Issue(IssueType.DEAD_CODE, "unused a", "a.py", "vulture"),
            new Issue(IssueType.DEAD_CODE, "unused b", "b.py", "vulture"),
            new Issue(IssueType.DEAD_CODE, "unused c", "c.py", "vulture"));

        // When
        List<EmbeddingVector> vectors = embedder.embedBatch(issues);

        // Then
        server.verify();
        assertThat(vectors).hasSize(3);
        assertThat(((DenseVector) vectors.get(0)).isZero()).isFalse();
        assertThat(((DenseVector) vectors.get(1)).isZero()).isFalse();
        assertThat(vectors.get(2)).isEqualTo(DenseVector.zeros(4));
    }

    @Test
    @DisplayName("Empty batch sends no request")
    void emptyBatchSendsNothing() {
        assertThat(embedder.embedBatch(List.of())).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("Availability probe rejects an answer of the wrong width")
    void probeRejectsWrongWidth() {
        server.expect(requestTo(SERVICE_URL))
            .andRespond(withSuccess("{\"data\":[{\"embedding\":[0.5],\"index\":0}]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> embedder.verifyAvailability())
            .isInstanceOf(EmbeddingServiceException.class)
            .hasMessageContaining("width mismatch");
    }
}
