package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import org.springframework.web.client.RestTemplate;

import de.leipzig.htwk.gitrdf.fixstrategy.config.EmbeddingServiceConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Capability detection for the process-wide embedder.
 *
 * Tries the neural encoder first; any failure while constructing or probing it selects the
 * statistical fallback for the rest of the process.
 */
@Slf4j
public final class IssueEmbedderSelector {

    private IssueEmbedderSelector() {
    }

    public static IssueEmbedder select(EmbeddingServiceConfig config, RestTemplate restTemplate) {
        if (!config.isNeuralEnabled()) {
            log.info("Neural embeddings disabled by configuration, using statistical fallback");
            return fallback(config);
        }
        if (!config.hasServiceUrl()) {
            log.warn("No embedding service URL configured (fix-strategy.embeddings.service-url), using statistical fallback");
            return fallback(config);
        }

        try {
            NeuralIssueEmbedder neural = new NeuralIssueEmbedder(config, restTemplate);
            neural.verifyAvailability();
            log.info("Neural embedder selected: {} ({} dimensions)", config.getModelId(), config.getDimensions());
            return neural;
        } catch (Exception e) {
            log.warn("Neural embedder unavailable ({}), falling back to statistical embeddings for this process",
                    e.getMessage());
            return fallback(config);
        }
    }

    private static IssueEmbedder fallback(EmbeddingServiceConfig config) {
        return new HashingTfIdfEmbedder(config.getFallbackWidth());
    }
}
