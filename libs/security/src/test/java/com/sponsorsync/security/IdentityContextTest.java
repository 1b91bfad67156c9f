package com.sponsorsync.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IdentityContext")
class IdentityContextTest {

    @Nested
    @DisplayName("anonymous()")
    class Anonymous {

        @Test
        @DisplayName("is not authenticated and has no principal")
        void notAuthenticated() {
            var ctx = IdentityContext.anonymous();
            assertThat(ctx.isAuthenticated()).isFalse();
            assertThat(ctx.principalId()).isEmpty();
        }
    }

    @Nested
    @DisplayName("authenticated()")
    class Authenticated {

        @Test
        @DisplayName("exposes the principal id")
        void exposesPrincipal() {
            var id = UUID.randomUUID();
            var ctx = IdentityContext.authenticated(id);
            assertThat(ctx.isAuthenticated()).isTrue();
            assertThat(ctx.principalId()).contains(id);
        }

        @Test
        @DisplayName("rejects a null principal")
        void rejectsNull() {
            assertThatThrownBy(() -> IdentityContext.authenticated(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("principal");
        }
    }
}
