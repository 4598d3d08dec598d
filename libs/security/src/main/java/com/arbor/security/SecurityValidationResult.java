package com.arbor.security;

import java.util.List;

/**
 * Result of validating an {@link ArborSecurityContext}.
 *
 * @param valid  whether the context passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }

    /** All errors joined into one message, for exception texts. */
    public String summary() {
        return String.join("; ", errors);
    }
}
