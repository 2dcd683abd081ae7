package de.leipzig.htwk.gitrdf.fixstrategy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Configuration for the sentence encoder and the statistical fallback
 */
@Component
@ConfigurationProperties(prefix = "fix-strategy.embeddings")
@Data
public class EmbeddingServiceConfig {

    // Neural encoder (OpenAI-style /embeddings endpoint)
    private boolean neuralEnabled = true;
    private String serviceUrl;
    private String modelId = "all-MiniLM-L6-v2";
    private int dimensions = 384;
    private int batchSize = 32;
    private int maxRetries = 3;
    private int timeoutSeconds = 15;
    private long retryBackoffMillis = 1000;

    // Statistical fallback
    private int fallbackWidth = 100;

    public boolean hasServiceUrl() {
        return serviceUrl != null && !serviceUrl.trim().isEmpty();
    }

    /**
     * Validate that the neural encoder is fully configured
     */
    public void validateConfiguration() {
        if (!hasServiceUrl()) {
            throw new IllegalStateException("Embedding service URL is not configured");
        }
        if (modelId == null || modelId.trim().isEmpty()) {
            throw new IllegalStateException("Model ID is not configured");
        }
        if (dimensions <= 0) {
            throw new IllegalStateException("Dimensions must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalStateException("Batch size must be positive");
        }
    }
}
