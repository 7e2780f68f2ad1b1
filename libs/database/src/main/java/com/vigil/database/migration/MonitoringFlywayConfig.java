package com.vigil.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Flyway instance of the monitoring database and migrates it on startup.
 *
 * <p>Services importing this configuration disable Spring Boot's own Flyway auto-configuration
 * ({@code spring.flyway.enabled: false}) so the schema is owned by a single bean.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "vigil.flyway.monitoring", name = "enabled", havingValue = "true")
public class MonitoringFlywayConfig {

    /** Bean name of the monitoring database Flyway instance. */
    public static final String MONITORING_FLYWAY_BEAN = "monitoringFlyway";

    @Bean(name = MONITORING_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway monitoringFlyway(FlywayConfigProperties properties) {
        return createFlyway(properties.monitoring());
    }

    @Bean
    public MigrationService migrationService(FlywayConfigProperties properties, Flyway monitoringFlyway) {
        return new MigrationService("monitoring", properties.monitoring().url(), monitoringFlyway);
    }

    static Flyway createFlyway(FlywayConfigProperties.DatabaseConfig config) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(config.url())
                        .username(config.username())
                        .password(config.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
