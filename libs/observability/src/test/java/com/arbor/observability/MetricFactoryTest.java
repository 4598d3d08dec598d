package com.arbor.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "hierarchy-service");
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("rejects null registry")
        void rejectsNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("rejects blank service name")
        void rejectsBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Tenant tag")
    class TenantTag {

        @Test
        @DisplayName("uses the explicit tenant when given")
        void explicitTenant() {
            Counter counter = factory.counter("arbor.test.ops", "ops", "tenant-a", "operation", "move");
            counter.increment();

            Counter found = registry.find("arbor.test.ops")
                    .tags(MetricFactory.TAG_SERVICE, "hierarchy-service",
                            MetricFactory.TAG_TENANT, "tenant-a",
                            "operation", "move")
                    .counter();
            assertThat(found).isNotNull();
            assertThat(found.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("falls back to the correlation context tenant")
        void correlationTenant() {
            CorrelationContextHolder.set(new CorrelationContext("corr", "tenant-ctx", "actor", null));

            factory.counter("arbor.test.ctx", "ctx", null).increment();

            assertThat(registry.find("arbor.test.ctx").tag(MetricFactory.TAG_TENANT, "tenant-ctx").counter())
                    .isNotNull();
        }

        @Test
        @DisplayName("tags unknown when no tenant is available")
        void unknownTenant() {
            factory.counter("arbor.test.unknown", "unknown", null).increment();

            assertThat(registry.find("arbor.test.unknown")
                    .tag(MetricFactory.TAG_TENANT, MetricFactory.UNKNOWN_TENANT)
                    .counter())
                    .isNotNull();
        }
    }

    @Test
    @DisplayName("repeated lookups return the same meter")
    void sameMeterForSameTags() {
        factory.counter("arbor.test.repeat", "repeat", "t").increment();
        factory.counter("arbor.test.repeat", "repeat", "t").increment();

        assertThat(registry.find("arbor.test.repeat").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("summary records amounts")
    void summaryRecords() {
        DistributionSummary summary = factory.summary("arbor.test.sizes", "sizes", "t");
        summary.record(3);
        summary.record(5);

        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(8.0);
        assertThat(factory.registry()).isSameAs(registry);
        assertThat(factory.serviceName()).isEqualTo("hierarchy-service");
    }
}
