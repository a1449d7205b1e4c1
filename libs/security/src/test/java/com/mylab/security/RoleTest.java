package com.mylab.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("PLATFORM_ADMIN implies every role")
        void platformAdminImpliesAll() {
            for (Role role : Role.values()) {
                assertThat(Role.PLATFORM_ADMIN.implies(role)).isTrue();
            }
        }

        @Test
        @DisplayName("ADMIN does not imply PLATFORM_ADMIN")
        void adminDoesNotImplyPlatformAdmin() {
            assertThat(Role.ADMIN.implies(Role.PLATFORM_ADMIN)).isFalse();
            assertThat(Role.ADMIN.implies(Role.MANAGER)).isTrue();
        }

        @Test
        @DisplayName("VIEWER implies only itself")
        void viewerImpliesOnlySelf() {
            assertThat(Role.VIEWER.impliedRoles()).isEmpty();
            assertThat(Role.VIEWER.implies(Role.VIEWER)).isTrue();
            assertThat(Role.VIEWER.implies(Role.SCIENTIST)).isFalse();
        }
    }

    @Nested
    @DisplayName("workspace baseline")
    class Baseline {

        @Test
        @DisplayName("maps roles to access levels")
        void mapsRolesToLevels() {
            assertThat(Role.ADMIN.workspaceBaseline()).isEqualTo(AccessLevel.FULL);
            assertThat(Role.MANAGER.workspaceBaseline()).isEqualTo(AccessLevel.EDIT);
            assertThat(Role.SCIENTIST.workspaceBaseline()).isEqualTo(AccessLevel.EDIT);
            assertThat(Role.VIEWER.workspaceBaseline()).isEqualTo(AccessLevel.VIEW);
        }
    }

    @Nested
    @DisplayName("fromString")
    class FromString {

        @Test
        @DisplayName("resolves wire values case-insensitively")
        void resolvesWireValues() {
            assertThat(Role.fromString("platform_admin")).contains(Role.PLATFORM_ADMIN);
            assertThat(Role.fromString("Admin")).contains(Role.ADMIN);
        }

        @Test
        @DisplayName("returns empty for unknown or null values")
        void emptyForUnknown() {
            assertThat(Role.fromString("owner")).isEmpty();
            assertThat(Role.fromString(null)).isEmpty();
            assertThat(Role.isKnown("root")).isFalse();
        }
    }
}
