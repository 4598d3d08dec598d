package com.arbor.observability;

/**
 * Immutable correlation context that travels with one request through the hierarchy service.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext} as soon as it arrives. Once the
 * caller's identity headers are resolved, the context is enriched with the tenant and actor via
 * {@link #withPrincipal(String, String)}. All values are copied into SLF4J MDC by
 * {@link CorrelationContextHolder} so that every log line of a structural mutation can be tied
 * back to the tenant whose tree it touched.
 *
 * @param correlationId unique ID for the business flow, propagated from {@code X-Correlation-ID}
 * @param tenantId      tenant whose hierarchy is being read or mutated (null until resolved, or
 *                      when the request establishes a new tenant)
 * @param actorId       identity performing the operation (null until resolved)
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String actorId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for actor ID. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a request whose caller has not been identified yet.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId);
    }

    /**
     * Returns a copy carrying the resolved tenant and actor.
     */
    public CorrelationContext withPrincipal(String tenantId, String actorId) {
        return new CorrelationContext(correlationId, tenantId, actorId, requestId);
    }
}
