package com.mylab.labservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.UnauthenticatedException;
import com.mylab.observability.CorrelationContext;
import com.mylab.observability.CorrelationContextHolder;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.Role;
import com.mylab.security.testing.TestSecurityContextFactory;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

@DisplayName("CallerContextArgumentResolver")
class CallerContextArgumentResolverTest {

    private final CallerContextArgumentResolver resolver = new CallerContextArgumentResolver();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private LabSecurityContext resolve(MockHttpServletRequest request) {
        return resolver.resolveArgument(null, null, new ServletWebRequest(request), null);
    }

    @Test
    @DisplayName("builds the caller context from a bearer token and tags the correlation context")
    void resolvesBearerToken() {
        UUID userId = UUID.randomUUID();
        UUID workspaceId = UUID.randomUUID();
        LabSecurityContext issued = TestSecurityContextFactory.create(userId, workspaceId, Role.MANAGER);
        CorrelationContextHolder.set(new CorrelationContext("corr-42", null, null, "req-1"));
        var request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, TestSecurityContextFactory.bearer(issued));

        LabSecurityContext context = resolve(request);

        assertThat(context.userId()).isEqualTo(userId);
        assertThat(context.workspaceId()).isEqualTo(workspaceId);
        assertThat(context.role()).isEqualTo(Role.MANAGER);
        assertThat(context.correlationId()).isEqualTo("corr-42");
        assertThat(CorrelationContextHolder.get()).get()
                .extracting(CorrelationContext::workspaceId)
                .isEqualTo(workspaceId.toString());
    }

    @Test
    @DisplayName("a missing Authorization header is unauthenticated")
    void missingToken() {
        assertThatThrownBy(() -> resolve(new MockHttpServletRequest()))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    @DisplayName("a token that does not decode is unauthenticated")
    void malformedToken() {
        var request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer not-a-session%%");

        assertThatThrownBy(() -> resolve(request)).isInstanceOf(UnauthenticatedException.class);
    }
}
