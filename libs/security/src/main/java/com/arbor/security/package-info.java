/**
 * Request identity and tenant isolation for Arbor services.
 *
 * <p>Authentication itself happens upstream; this package only models the asserted actor and
 * tenant, validates them, and conceals resources of other tenants.
 */
package com.arbor.security;
