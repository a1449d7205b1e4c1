package com.mylab.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.mylab.security.testing.TestSecurityContextFactory;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CapabilityResolver")
class CapabilityResolverTest {

    private final UUID home = UUID.randomUUID();
    private final UUID foreign = UUID.randomUUID();

    @Nested
    @DisplayName("own workspace")
    class OwnWorkspace {

        @Test
        @DisplayName("viewer gets view without a grant")
        void viewerBaseline() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.VIEWER);

            assertThat(CapabilityResolver.resolve(ctx, home, Optional.empty())).contains(AccessLevel.VIEW);
        }

        @Test
        @DisplayName("a stronger grant raises the role baseline")
        void grantRaisesBaseline() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.VIEWER);

            assertThat(CapabilityResolver.resolve(ctx, home, Optional.of(AccessLevel.FULL)))
                    .contains(AccessLevel.FULL);
        }

        @Test
        @DisplayName("a weaker grant never lowers the role baseline")
        void weakerGrantIgnored() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.ADMIN);

            assertThat(CapabilityResolver.resolve(ctx, home, Optional.of(AccessLevel.VIEW)))
                    .contains(AccessLevel.FULL);
        }
    }

    @Nested
    @DisplayName("foreign workspace")
    class ForeignWorkspace {

        @Test
        @DisplayName("admin of another workspace has no access without a grant")
        void noAccessWithoutGrant() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.ADMIN);

            assertThat(CapabilityResolver.resolve(ctx, foreign, Optional.empty())).isEmpty();
            assertThat(CapabilityResolver.permits(ctx, foreign, Optional.empty(), AccessLevel.VIEW)).isFalse();
        }

        @Test
        @DisplayName("grant alone decides the level")
        void grantDecides() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.ADMIN);

            assertThat(CapabilityResolver.resolve(ctx, foreign, Optional.of(AccessLevel.VIEW)))
                    .contains(AccessLevel.VIEW);
            assertThat(CapabilityResolver.permits(ctx, foreign, Optional.of(AccessLevel.VIEW), AccessLevel.EDIT))
                    .isFalse();
        }

        @Test
        @DisplayName("platform admin has full access everywhere")
        void platformAdmin() {
            var ctx = TestSecurityContextFactory.createForWorkspace(home, Role.PLATFORM_ADMIN);

            assertThat(CapabilityResolver.resolve(ctx, foreign, Optional.empty())).contains(AccessLevel.FULL);
        }
    }
}
