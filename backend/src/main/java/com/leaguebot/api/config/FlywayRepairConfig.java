package com.leaguebot.api.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "spring.flyway.enabled", havingValue = "true", matchIfMissing = true)
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            try {
                log.info("[Flyway] Running repair before migrate");
                flyway.repair();
            } catch (Exception ex) {
                log.warn("[Flyway] Repair failed or not needed: {}", ex.getMessage());
            }
            var result = flyway.migrate();
            log.info("[Flyway] Applied {} migration(s), schema version={}",
                    result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
