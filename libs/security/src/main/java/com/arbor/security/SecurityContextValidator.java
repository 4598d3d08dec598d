package com.arbor.security;

import java.util.ArrayList;

/**
 * Validates that an {@link ArborSecurityContext} has its required fields populated.
 * All errors are reported at once.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    public static SecurityValidationResult validate(ArborSecurityContext context) {
        var errors = new ArrayList<String>();

        if (context.actor() == null) {
            errors.add("actor must not be null");
        } else if (isBlank(context.actor().actorId())) {
            errors.add("actor.actorId must not be null or blank");
        }

        // A missing tenant is legal (new tenant), a present-but-blank one is not.
        if (context.tenant() != null && isBlank(context.tenant().tenantId())) {
            errors.add("tenant.tenantId must not be blank when a tenant is given");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
