package com.arbor.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, tenantId, actorId, requestId) are
 * populated so that every log statement on this thread includes them. When cleared, the keys are
 * removed. Work handed to another thread must carry the context explicitly, see
 * {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the tenant of the current context, if one has been resolved.
     */
    public static Optional<String> currentTenantId() {
        return get().map(CorrelationContext::tenantId);
    }

    /**
     * Enriches the current context with tenant and actor. No-op when no context is set.
     */
    public static void attachPrincipal(String tenantId, String actorId) {
        get().ifPresent(ctx -> set(ctx.withPrincipal(tenantId, actorId)));
    }

    /**
     * Clears the correlation context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_ACTOR_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Executes a {@link Runnable} with the given context set, then restores the previous context
     * (or clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        putOrRemove(CorrelationContext.MDC_ACTOR_ID, ctx.actorId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
