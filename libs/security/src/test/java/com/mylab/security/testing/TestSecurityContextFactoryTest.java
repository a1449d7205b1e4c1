package com.mylab.security.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.mylab.security.Role;
import com.mylab.security.SecurityContextValidator;
import com.mylab.security.SessionTokenCodec;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TestSecurityContextFactory")
class TestSecurityContextFactoryTest {

    @Test
    @DisplayName("default context is a scientist")
    void defaultContext() {
        var ctx = TestSecurityContextFactory.create();

        assertThat(ctx.role()).isEqualTo(Role.SCIENTIST);
        assertThat(ctx.workspaceId()).isNotNull();
    }

    @Test
    @DisplayName("bearer header decodes back to a valid context for the same caller")
    void bearerDecodes() {
        UUID workspace = UUID.randomUUID();
        var ctx = TestSecurityContextFactory.createForWorkspace(workspace, Role.MANAGER);

        String token = SessionTokenCodec.fromAuthorizationHeader(TestSecurityContextFactory.bearer(ctx)).orElseThrow();
        var decoded = SecurityContextValidator.toContext(SessionTokenCodec.decode(token), token, "c");

        assertThat(decoded.workspaceId()).isEqualTo(workspace);
        assertThat(decoded.userId()).isEqualTo(ctx.userId());
        assertThat(decoded.role()).isEqualTo(Role.MANAGER);
    }
}
