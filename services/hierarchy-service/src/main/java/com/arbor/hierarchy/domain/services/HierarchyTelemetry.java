package com.arbor.hierarchy.domain.services;

import com.arbor.observability.MetricFactory;
import com.arbor.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Metrics and spans emitted by the hierarchy engine.
 */
public final class HierarchyTelemetry {

    public static final String MUTATIONS = "arbor.hierarchy.mutations";
    public static final String REJECTIONS = "arbor.hierarchy.rejections";
    public static final String CASCADE_SIZE = "arbor.hierarchy.cascade.size";

    private final MetricFactory metrics;
    private final SpanHelper spans;

    public HierarchyTelemetry(MetricFactory metrics, SpanHelper spans) {
        this.metrics = metrics;
        this.spans = spans;
    }

    /** Telemetry backed by an in-process registry and a no-op tracer. */
    public static HierarchyTelemetry standalone() {
        return new HierarchyTelemetry(
                new MetricFactory(new SimpleMeterRegistry(), "hierarchy-service"),
                new SpanHelper(OpenTelemetry.noop().getTracer("arbor-hierarchy")));
    }

    /** Runs {@code work} inside a {@code hierarchy.<operation>} span. */
    public <T> T trace(String operation, String tenantId, String nodeId, Supplier<T> work) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("tenant.id", tenantId);
        attributes.put("node.id", nodeId);
        return spans.inSpan("hierarchy." + operation, attributes, work);
    }

    public void recordMutation(String operation, String tenantId) {
        metrics.counter(MUTATIONS, "Committed structural mutations", tenantId, "operation", operation)
                .increment();
    }

    public void recordRejection(String operation, String tenantId, String reason) {
        metrics.counter(REJECTIONS, "Rejected hierarchy operations", tenantId,
                        "operation", operation, "reason", reason)
                .increment();
    }

    public void recordCascade(String operation, String tenantId, int rewritten) {
        metrics.summary(CASCADE_SIZE, "Descendants rewritten per cascade", tenantId, "operation", operation)
                .record(rewritten);
    }

    public MetricFactory metrics() {
        return metrics;
    }
}
