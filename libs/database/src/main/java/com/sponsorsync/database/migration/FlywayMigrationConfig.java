package com.sponsorsync.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Flyway configuration for the marketplace database.
 *
 * <p>Spring Boot's own Flyway auto-configuration backs off as soon as this module contributes a
 * {@link Flyway} bean. Services should still disable it explicitly to avoid surprises:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>The bean runs {@link Flyway#migrate()} on initialization, so any bean that depends on the
 * {@link #MARKETPLACE_FLYWAY_BEAN} sees a fully migrated schema.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "sponsorsync.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name for the marketplace Flyway instance. */
    public static final String MARKETPLACE_FLYWAY_BEAN = "marketplaceFlyway";

    /**
     * Creates the Flyway instance for the marketplace database and migrates it on startup.
     *
     * @param properties externalized Flyway configuration
     * @return configured Flyway instance
     */
    @Bean(name = MARKETPLACE_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway marketplaceFlyway(FlywayConfigProperties properties) {
        log.info("Configuring Flyway for {} with locations {}", properties.url(), properties.locations());
        return createFlyway(properties);
    }

    /**
     * Builds a Flyway instance from the given properties. Exposed for tests and tooling that run
     * migrations outside a Spring context.
     */
    public static Flyway createFlyway(FlywayConfigProperties properties) {
        DataSource dataSource =
                new DriverManagerDataSource(
                        properties.url(), properties.username(), properties.password());

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
