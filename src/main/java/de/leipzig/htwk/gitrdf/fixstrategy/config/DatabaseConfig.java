package de.leipzig.htwk.gitrdf.fixstrategy.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.leipzig.htwk.gitrdf.fixstrategy.repository.AttemptStore;

/**
 * Configuration for the attempt log database file
 */
@Configuration
public class DatabaseConfig {

    @Bean(destroyMethod = "close")
    public AttemptStore attemptStore(AttemptStoreConfig config, ObjectMapper objectMapper) {
        return new AttemptStore(
            Path.of(config.getPath()),
            config.getSchemaLocation(),
            config.getMaxPoolSize(),
            config.getBusyTimeoutMillis(),
            objectMapper,
            Clock.systemUTC());
    }
}
