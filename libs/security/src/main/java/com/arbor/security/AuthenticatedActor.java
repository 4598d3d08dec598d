package com.arbor.security;

/**
 * The identity performing a hierarchy operation, as asserted by the upstream identity layer.
 * <p>
 * This is the "who" stamped into {@code createdBy} and
 * {@code updatedBy} of every node the engine writes.
 *
 * @param actorId     unique actor identifier
 * @param displayName optional human-readable name
 */
public record AuthenticatedActor(String actorId, String displayName) {

    public static AuthenticatedActor of(String actorId) {
        return new AuthenticatedActor(actorId, null);
    }
}
