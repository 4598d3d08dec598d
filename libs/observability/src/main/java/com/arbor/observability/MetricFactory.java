package com.arbor.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Factory for Micrometer meters that always carry a {@code service} and a {@code tenant} tag.
 * <p>
 * The tenant tag comes from the explicit argument when given, otherwise from the tenant resolved
 * on the current {@link CorrelationContextHolder}, otherwise {@link #UNKNOWN_TENANT}. Meters are
 * looked up by name and tags, so repeated calls return the same registered meter.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag value used when no tenant is known (e.g. a request establishing a new tenant). */
    public static final String UNKNOWN_TENANT = "unknown";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a tag on every meter
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns a counter tagged with service, tenant and the given extra tags.
     *
     * @param name        metric name (e.g., "arbor.hierarchy.mutations")
     * @param description human-readable description
     * @param tenantId    tenant to tag with; null falls back to the current correlation context
     * @param tags        additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String tenantId, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tenantId, tags))
                .register(registry);
    }

    /**
     * Returns a distribution summary tagged with service, tenant and the given extra tags.
     */
    public DistributionSummary summary(String name, String description, String tenantId, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(baseTags(tenantId, tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String tenantId, String... extraTags) {
        String tenant = tenantId != null
                ? tenantId
                : CorrelationContextHolder.currentTenantId().orElse(UNKNOWN_TENANT);
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_TENANT, tenant);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
