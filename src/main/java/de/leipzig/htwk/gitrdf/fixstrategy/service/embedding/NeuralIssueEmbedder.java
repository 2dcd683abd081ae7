package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.web.client.RestTemplate;

import de.leipzig.htwk.gitrdf.fixstrategy.config.EmbeddingServiceConfig;
import de.leipzig.htwk.gitrdf.fixstrategy.exception.EmbeddingServiceException;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.DenseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingKind;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import lombok.extern.slf4j.Slf4j;

/**
 * Dense embedder backed by an external sentence-transformer service.
 *
 * Request:  {"input": ["text1", "text2"], "model": "all-MiniLM-L6-v2", "dimensions": 384}
 * Response: {"data": [{"embedding": [...], "index": 0}], "model": "..."}
 *
 * Any failure after the configured retries degrades to a zero vector of the declared width.
 */
@Slf4j
public class NeuralIssueEmbedder implements IssueEmbedder {

    static final String PROBE_TEXT = "type: formatting | message: availability probe";

    private final EmbeddingServiceConfig config;
    private final RestTemplate restTemplate;

    public NeuralIssueEmbedder(EmbeddingServiceConfig config, RestTemplate restTemplate) {
        config.validateConfiguration();
        this.config = config;
        this.restTemplate = restTemplate;
    }

    /**
     * Send one probe text and check the width of the answer.
     *
     * @throws EmbeddingServiceException when the service is unreachable or answers with the wrong width
     */
    public void verifyAvailability() {
        log.info("Probing embedding service at {} (model: {}, dimensions: {})",
                config.getServiceUrl(), config.getModelId(), config.getDimensions());
        List<DenseVector> probe = callEmbeddingService(List.of(PROBE_TEXT));
        if (probe.size() != 1 || probe.get(0).isZero()) {
            throw new EmbeddingServiceException("Embedding service returned an unusable probe vector");
        }
        log.info("Embedding service available ({} dimensions)", probe.get(0).dimensions());
    }

    @Override
    public EmbeddingVector embedText(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty text passed to neural embedder, returning zero vector");
            return DenseVector.zeros(config.getDimensions());
        }

        try {
            return generateEmbeddingsWithRetry(List.of(text)).get(0);
        } catch (Exception e) {
            log.error("Neural embedding degraded to zero vector: {} - {}", e.getClass().getSimpleName(), e.getMessage());
            return DenseVector.zeros(config.getDimensions());
        }
    }

    @Override
    public List<EmbeddingVector> embedBatch(List<Issue> issues) {
        if (issues.isEmpty()) {
            return List.of();
        }

        List<String> texts = issues.stream()
            .map(IssueFeatureTextBuilder::buildFeatureText)
            .collect(Collectors.toList());

        List<EmbeddingVector> embeddings = new ArrayList<>(texts.size());
        for (List<String> batch : createBatches(texts, config.getBatchSize())) {
            try {
                embeddings.addAll(generateEmbeddingsWithRetry(batch));
            } catch (Exception e) {
                log.error("Neural embedding degraded to zero vectors for batch of {}: {}", batch.size(), e.getMessage());
                for (int i = 0; i < batch.size(); i++) {
                    embeddings.add(DenseVector.zeros(config.getDimensions()));
                }
            }
        }
        return embeddings;
    }

    @Override
    public boolean isNeuralAvailable() {
        return true;
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.DENSE;
    }

    @Override
    public int dimensions() {
        return config.getDimensions();
    }

    private List<DenseVector> generateEmbeddingsWithRetry(List<String> texts) {
        int maxRetries = Math.max(1, config.getMaxRetries());
        EmbeddingServiceException lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return callEmbeddingService(texts);
            } catch (RuntimeException e) {
                lastException = e instanceof EmbeddingServiceException serviceException
                    ? serviceException
                    : new EmbeddingServiceException("Embedding request failed: " + e.getMessage(), e);
                log.warn("Attempt {}/{} to embed {} texts failed: {}", attempt, maxRetries, texts.size(), e.getMessage());

                if (attempt < maxRetries) {
                    backOff(attempt);
                }
            }
        }

        throw lastException;
    }

    private void backOff(int attempt) {
        long sleepTime = config.getRetryBackoffMillis() * attempt;
        if (sleepTime <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepTime);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceException("Interrupted during retry backoff", ie);
        }
    }

    private List<DenseVector> callEmbeddingService(List<String> texts) {
        Map<String, Object> request = new HashMap<>();
        request.put("input", texts);
        request.put("model", config.getModelId());
        request.put("dimensions", config.getDimensions());

        log.debug("POST {} with {} texts", config.getServiceUrl(), texts.size());

        Map<String, Object> response;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> body = restTemplate.postForObject(config.getServiceUrl(), request, Map.class);
            response = body;
        } catch (RuntimeException e) {
            throw new EmbeddingServiceException("HTTP request to " + config.getServiceUrl() + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new EmbeddingServiceException("Null response from embedding service at " + config.getServiceUrl());
        }
        return parseEmbeddingResponse(response, texts.size());
    }

    private List<DenseVector> parseEmbeddingResponse(Map<String, Object> response, int expectedCount) {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> dataList = (List<Map<String, Object>>) response.get("data");

        if (dataList == null) {
            throw new EmbeddingServiceException("Embedding service returned no data field, keys: " + response.keySet());
        }
        if (dataList.size() != expectedCount) {
            throw new EmbeddingServiceException(String.format(
                "Embedding count mismatch: expected %d, got %d", expectedCount, dataList.size()));
        }

        List<Map<String, Object>> ordered = new ArrayList<>(dataList);
        ordered.sort(Comparator.comparingInt(data -> data.get("index") instanceof Number index ? index.intValue() : 0));

        List<DenseVector> embeddings = new ArrayList<>(ordered.size());
        for (Map<String, Object> data : ordered) {
            @SuppressWarnings("unchecked")
            List<Number> values = (List<Number>) data.get("embedding");
            if (values == null || values.isEmpty()) {
                throw new EmbeddingServiceException("Empty embedding in response, data keys: " + data.keySet());
            }
            if (values.size() != config.getDimensions()) {
                throw new EmbeddingServiceException(String.format(
                    "Embedding width mismatch: expected %d, got %d", config.getDimensions(), values.size()));
            }

            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            embeddings.add(new DenseVector(vector));
        }
        return embeddings;
    }

    private static <T> List<List<T>> createBatches(List<T> items, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            batches.add(items.subList(i, Math.min(i + batchSize, items.size())));
        }
        return batches;
    }
}
