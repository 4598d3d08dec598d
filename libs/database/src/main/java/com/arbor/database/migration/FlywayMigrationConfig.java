package com.arbor.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the hierarchy schema.
 *
 * <p>Spring Boot's own Flyway auto-configuration is switched off ({@code spring.flyway.enabled:
 * false}); this class owns migrations so the schema location and credentials live under
 * {@code arbor.flyway.*}. The {@link #HIERARCHY_FLYWAY_BEAN} bean has already migrated when it is
 * returned, so anything that needs the schema obtains this bean first. Its migration DataSource is
 * closed afterwards; the returned instance is not meant to run further commands.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "arbor.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name of the hierarchy database Flyway instance. */
    public static final String HIERARCHY_FLYWAY_BEAN = "hierarchyFlyway";

    @Bean(name = HIERARCHY_FLYWAY_BEAN)
    public Flyway hierarchyFlyway(FlywayConfigProperties properties) {
        log.info("Configuring hierarchy migrations from {} against {}", properties.locations(), properties.url());
        Flyway flyway = createFlyway(properties);
        migrateAndRelease(flyway);
        return flyway;
    }

    /**
     * Runs pending migrations, then closes the DataSource the instance was built with.
     */
    static MigrateResult migrateAndRelease(Flyway flyway) {
        DataSource dataSource = flyway.getConfiguration().getDataSource();
        try {
            MigrateResult result = flyway.migrate();
            log.info("Applied {} hierarchy migrations, schema at version {}",
                    result.migrationsExecuted, result.targetSchemaVersion);
            return result;
        } finally {
            if (dataSource instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Could not close the migration DataSource", e);
                }
            }
        }
    }

    /**
     * Builds an unmigrated Flyway instance with its own DataSource. Package-visible so tests can
     * migrate an in-memory database without a Spring context.
     */
    static Flyway createFlyway(FlywayConfigProperties properties) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
