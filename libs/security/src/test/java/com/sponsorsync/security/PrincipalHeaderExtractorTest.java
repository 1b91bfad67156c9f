package com.sponsorsync.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for PrincipalHeaderExtractor: a valid UUID header authenticates, anything else is anonymous.
 */
@DisplayName("PrincipalHeaderExtractor")
class PrincipalHeaderExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("extracts the principal from a UUID header")
        void extractsPrincipal() {
            var id = UUID.randomUUID();
            var ctx = PrincipalHeaderExtractor.extract(id.toString());
            assertThat(ctx.principalId()).contains(id);
        }

        @Test
        @DisplayName("tolerates surrounding whitespace")
        void stripsWhitespace() {
            var id = UUID.randomUUID();
            assertThat(PrincipalHeaderExtractor.extract("  " + id + " ").principalId()).contains(id);
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("null header is anonymous")
        void nullHeader() {
            assertThat(PrincipalHeaderExtractor.extract(null).isAuthenticated()).isFalse();
        }

        @Test
        @DisplayName("blank header is anonymous")
        void blankHeader() {
            assertThat(PrincipalHeaderExtractor.extract("   ").isAuthenticated()).isFalse();
        }

        @Test
        @DisplayName("non-UUID header is anonymous")
        void malformedHeader() {
            assertThat(PrincipalHeaderExtractor.extract("Bearer abc").isAuthenticated()).isFalse();
        }
    }
}
