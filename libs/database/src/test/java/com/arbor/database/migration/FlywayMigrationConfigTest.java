package com.arbor.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Configuration;

@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    @Test
    @DisplayName("is a Spring configuration with a stable bean name")
    void configurationShape() {
        assertThat(FlywayMigrationConfig.class.isAnnotationPresent(Configuration.class)).isTrue();
        assertThat(FlywayMigrationConfig.HIERARCHY_FLYWAY_BEAN).isEqualTo("hierarchyFlyway");
    }

    @Nested
    @DisplayName("FlywayConfigProperties")
    class Properties {

        @Test
        @DisplayName("defaults locations to the bundled hierarchy migrations")
        void defaultsLocations() {
            var props = new FlywayConfigProperties("jdbc:h2:mem:x", "sa", "", null, true);

            assertThat(props.locations()).isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
        }

        @Test
        @DisplayName("keeps explicit locations")
        void keepsLocations() {
            var props = new FlywayConfigProperties("jdbc:h2:mem:x", "sa", "", "classpath:custom", true);

            assertThat(props.locations()).isEqualTo("classpath:custom");
        }
    }

    @Test
    @DisplayName("migrates an H2 database in PostgreSQL mode")
    void migratesH2() throws SQLException {
        String url = "jdbc:h2:mem:flyway-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
        Flyway flyway = FlywayMigrationConfig.createFlyway(new FlywayConfigProperties(url, "sa", "", null, true));

        MigrateResult result = flyway.migrate();

        assertThat(result.migrationsExecuted).isEqualTo(2);
        try (Connection connection = flyway.getConfiguration().getDataSource().getConnection();
                ResultSet tables = connection.getMetaData().getTables(null, null, "%", new String[] {"TABLE"})) {
            var names = new java.util.ArrayList<String>();
            while (tables.next()) {
                names.add(tables.getString("TABLE_NAME").toLowerCase());
            }
            assertThat(names).contains("hierarchy_nodes", "node_occupants");
        }
    }

    @Test
    @DisplayName("closes its DataSource once migrations have run")
    void releasesDataSourceAfterMigrating() throws SQLException {
        String url = "jdbc:h2:mem:flyway-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
        Flyway flyway = FlywayMigrationConfig.createFlyway(new FlywayConfigProperties(url, "sa", "", null, true));
        DataSource dataSource = flyway.getConfiguration().getDataSource();

        MigrateResult result = FlywayMigrationConfig.migrateAndRelease(flyway);

        assertThat(result.migrationsExecuted).isEqualTo(2);
        assertThatThrownBy(dataSource::getConnection).isInstanceOf(SQLException.class);
        try (Connection connection = DriverManager.getConnection(url, "sa", "");
                ResultSet tables = connection.getMetaData().getTables(null, null, "%", new String[] {"TABLE"})) {
            var names = new java.util.ArrayList<String>();
            while (tables.next()) {
                names.add(tables.getString("TABLE_NAME").toLowerCase());
            }
            assertThat(names).contains("hierarchy_nodes");
        }
    }
}
