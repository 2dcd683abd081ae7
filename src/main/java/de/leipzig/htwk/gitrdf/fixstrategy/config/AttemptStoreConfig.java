package de.leipzig.htwk.gitrdf.fixstrategy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Location and connection settings of the attempt log database file
 */
@Component
@ConfigurationProperties(prefix = "fix-strategy.store")
@Data
public class AttemptStoreConfig {

    private String path = "data/fix_strategy_memory.db";
    private String schemaLocation = "classpath:db/fix_strategy_schema.sql";
    private int maxPoolSize = 4;
    private int busyTimeoutMillis = 5000;
}
