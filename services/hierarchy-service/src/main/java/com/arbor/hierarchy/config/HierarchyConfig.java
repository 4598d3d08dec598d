package com.arbor.hierarchy.config;

import com.arbor.database.migration.FlywayMigrationConfig;
import com.arbor.hierarchy.domain.ports.NodeIdGenerator;
import com.arbor.hierarchy.domain.ports.NodeStore;
import com.arbor.hierarchy.domain.ports.OccupantRegistry;
import com.arbor.hierarchy.domain.ports.TenantMutationLock;
import com.arbor.hierarchy.domain.services.HierarchyEngine;
import com.arbor.hierarchy.domain.services.HierarchyTelemetry;
import com.arbor.hierarchy.infrastructure.locking.InProcessTenantMutationLock;
import com.arbor.hierarchy.infrastructure.occupancy.InMemoryOccupantRegistry;
import com.arbor.hierarchy.infrastructure.occupancy.JdbcOccupantRegistry;
import com.arbor.hierarchy.infrastructure.persistence.InMemoryNodeStore;
import com.arbor.hierarchy.infrastructure.persistence.JdbcNodeStore;
import com.arbor.observability.MetricFactory;
import com.arbor.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Wires the hierarchy engine and picks its store adapters from {@code arbor.hierarchy.store}.
 */
@Configuration
@EnableConfigurationProperties({HierarchyProperties.class, ServiceProperties.class})
@Import(FlywayMigrationConfig.class)
public class HierarchyConfig {

    private static final Logger log = LoggerFactory.getLogger(HierarchyConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeIdGenerator nodeIdGenerator() {
        return NodeIdGenerator.randomUuid();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        // no-op unless an agent or SDK registered itself globally
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public HierarchyTelemetry hierarchyTelemetry(
            MeterRegistry meterRegistry, OpenTelemetry openTelemetry, ServiceProperties service) {
        return new HierarchyTelemetry(
                new MetricFactory(meterRegistry, service.name()),
                new SpanHelper(openTelemetry.getTracer("arbor-hierarchy")));
    }

    @Bean
    public TenantMutationLock tenantMutationLock(HierarchyProperties properties) {
        return new InProcessTenantMutationLock(properties.lockTimeout());
    }

    @Bean
    public HierarchyEngine hierarchyEngine(
            NodeStore store,
            OccupantRegistry occupants,
            TenantMutationLock lock,
            HierarchyProperties properties,
            NodeIdGenerator idGenerator,
            Clock clock,
            HierarchyTelemetry telemetry) {
        log.info("Hierarchy engine using {} store, separator '{}', multiple roots {}",
                properties.store(), properties.separator(),
                properties.allowMultipleRoots() ? "allowed" : "disallowed");
        return new HierarchyEngine(store, occupants, lock, properties.toPolicy(), idGenerator, clock, telemetry);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "arbor.hierarchy", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfig {

        @Bean
        public InMemoryNodeStore nodeStore() {
            return new InMemoryNodeStore();
        }

        @Bean
        public InMemoryOccupantRegistry occupantRegistry() {
            return new InMemoryOccupantRegistry();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "arbor.hierarchy", name = "store", havingValue = "jdbc")
    static class JdbcStoreConfig {

        @Bean
        public JdbcNodeStore nodeStore(NamedParameterJdbcTemplate jdbc, ObjectProvider<Flyway> flyway) {
            // resolving the Flyway bean runs pending migrations before the first query
            flyway.ifAvailable(migrations ->
                    log.info("Node store schema has {} applied migrations", migrations.info().applied().length));
            return new JdbcNodeStore(jdbc);
        }

        @Bean
        public JdbcOccupantRegistry occupantRegistry(JdbcTemplate jdbc) {
            return new JdbcOccupantRegistry(jdbc);
        }
    }
}
