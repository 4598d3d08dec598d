package com.arbor.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arbor.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextValidator")
class SecurityContextValidatorTest {

    @Test
    @DisplayName("accepts a tenant-scoped context")
    void acceptsTenantScoped() {
        var result = SecurityContextValidator.validate(TestSecurityContextFactory.createForTenant("tenant-1"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("accepts a context without tenant")
    void acceptsNewTenant() {
        var ctx = TestSecurityContextFactory.createForNewTenant();

        assertThat(SecurityContextValidator.validate(ctx).valid()).isTrue();
        assertThat(ctx.tenantId()).isEmpty();
        assertThatThrownBy(ctx::requireTenantId).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("reports every problem at once")
    void collectsAllErrors() {
        var ctx = new ArborSecurityContext(AuthenticatedActor.of(" "), new TenantContext(""), "corr");

        var result = SecurityContextValidator.validate(ctx);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.summary()).contains("actor.actorId").contains("tenant.tenantId");
    }

    @Test
    @DisplayName("rejects a missing actor")
    void rejectsMissingActor() {
        var result = SecurityContextValidator.validate(new ArborSecurityContext(null, null, "corr"));

        assertThat(result.errors()).containsExactly("actor must not be null");
    }
}
