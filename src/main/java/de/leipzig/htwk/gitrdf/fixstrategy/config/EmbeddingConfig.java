package de.leipzig.htwk.gitrdf.fixstrategy.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedder;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.IssueEmbedderSelector;

/**
 * Wires the process-wide embedder. Selection runs once, when the singleton is created.
 */
@Configuration
public class EmbeddingConfig {

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingServiceConfig config) {
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }

    @Bean
    public IssueEmbedder issueEmbedder(EmbeddingServiceConfig config, RestTemplate embeddingRestTemplate) {
        return IssueEmbedderSelector.select(config, embeddingRestTemplate);
    }
}
