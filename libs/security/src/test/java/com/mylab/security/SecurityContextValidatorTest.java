package com.mylab.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextValidator")
class SecurityContextValidatorTest {

    private final String userId = UUID.randomUUID().toString();
    private final String workspaceId = UUID.randomUUID().toString();

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts well-formed claims")
        void acceptsValid() {
            var violations = SecurityContextValidator.validate(
                    new SessionClaims(userId, "a@b", null, workspaceId, "scientist"));

            assertThat(violations).isEmpty();
        }

        @Test
        @DisplayName("reports every problem at once")
        void reportsAllErrors() {
            var violations = SecurityContextValidator.validate(
                    new SessionClaims("not-a-uuid", null, null, "", "superuser"));

            assertThat(violations).hasSize(3)
                    .anyMatch(e -> e.contains("userId"))
                    .anyMatch(e -> e.contains("workspaceId"))
                    .anyMatch(e -> e.contains("superuser"));
        }

        @Test
        @DisplayName("rejects null claims")
        void rejectsNull() {
            assertThat(SecurityContextValidator.validate(null)).containsExactly("claims must not be null");
        }
    }

    @Nested
    @DisplayName("toContext")
    class ToContext {

        @Test
        @DisplayName("builds the caller context from valid claims")
        void buildsContext() {
            var ctx = SecurityContextValidator.toContext(
                    new SessionClaims(userId, "a@b", "A", workspaceId, "admin"), "tok", "corr-1");

            assertThat(ctx.userId()).isEqualTo(UUID.fromString(userId));
            assertThat(ctx.workspaceId()).isEqualTo(UUID.fromString(workspaceId));
            assertThat(ctx.role()).isEqualTo(Role.ADMIN);
            assertThat(ctx.correlationId()).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("throws with the validation errors for invalid claims")
        void throwsForInvalid() {
            assertThatThrownBy(() -> SecurityContextValidator.toContext(
                    new SessionClaims(userId, null, null, workspaceId, "nobody"), "tok", "c"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nobody");
        }
    }
}
