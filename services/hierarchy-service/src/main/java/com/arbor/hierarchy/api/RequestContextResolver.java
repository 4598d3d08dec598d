package com.arbor.hierarchy.api;

import com.arbor.observability.CorrelationContext;
import com.arbor.observability.CorrelationContextHolder;
import com.arbor.security.ArborSecurityContext;
import com.arbor.security.AuthenticatedActor;
import com.arbor.security.SecurityContextValidator;
import com.arbor.security.SecurityValidationResult;
import com.arbor.security.TenantContext;
import org.springframework.stereotype.Component;

/**
 * Turns the identity headers forwarded by the authentication gateway into an
 * {@link ArborSecurityContext} and attaches the principal to the correlation context, so logs,
 * spans and metrics of the request carry tenant and actor.
 */
@Component
public class RequestContextResolver {

    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String ACTOR_HEADER = "X-Actor-ID";

    /**
     * @param tenantId the tenant header, null when the request establishes a new tenant
     * @param actorId  the actor header
     * @throws IllegalArgumentException if the resulting context is invalid
     */
    public ArborSecurityContext resolve(String tenantId, String actorId) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElse(null);
        ArborSecurityContext context = new ArborSecurityContext(
                actorId == null ? null : AuthenticatedActor.of(actorId),
                tenantId == null ? null : new TenantContext(tenantId),
                correlationId);

        SecurityValidationResult result = SecurityContextValidator.validate(context);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid request identity: " + result.summary());
        }
        CorrelationContextHolder.attachPrincipal(tenantId, actorId);
        return context;
    }
}
