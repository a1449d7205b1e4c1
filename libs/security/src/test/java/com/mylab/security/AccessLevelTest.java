package com.mylab.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AccessLevel")
class AccessLevelTest {

    @Test
    @DisplayName("stronger levels imply weaker ones")
    void orderingImplies() {
        assertThat(AccessLevel.FULL.implies(AccessLevel.EDIT)).isTrue();
        assertThat(AccessLevel.EDIT.implies(AccessLevel.VIEW)).isTrue();
        assertThat(AccessLevel.VIEW.implies(AccessLevel.EDIT)).isFalse();
    }

    @Test
    @DisplayName("strongest tolerates null on either side")
    void strongestHandlesNull() {
        assertThat(AccessLevel.strongest(null, AccessLevel.VIEW)).isEqualTo(AccessLevel.VIEW);
        assertThat(AccessLevel.strongest(AccessLevel.EDIT, null)).isEqualTo(AccessLevel.EDIT);
        assertThat(AccessLevel.strongest(AccessLevel.EDIT, AccessLevel.FULL)).isEqualTo(AccessLevel.FULL);
        assertThat(AccessLevel.strongest(null, null)).isNull();
    }

    @Test
    @DisplayName("fromString accepts wire values only")
    void fromString() {
        assertThat(AccessLevel.fromString("full")).contains(AccessLevel.FULL);
        assertThat(AccessLevel.fromString(" VIEW ")).contains(AccessLevel.VIEW);
        assertThat(AccessLevel.fromString("admin")).isEmpty();
    }

    @Test
    @DisplayName("fromValue rejects unknown levels")
    void fromValueStrict() {
        assertThat(AccessLevel.fromValue("edit")).isEqualTo(AccessLevel.EDIT);
        assertThatThrownBy(() -> AccessLevel.fromValue("owner"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("owner");
    }
}
