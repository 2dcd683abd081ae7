package de.leipzig.htwk.gitrdf.fixstrategy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

// The attempt store owns its SQLite pool; there is no application-wide DataSource
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
public class FixStrategyApplication {
    public static void main(String[] args) {
        SpringApplication.run(FixStrategyApplication.class, args);
    }
}
