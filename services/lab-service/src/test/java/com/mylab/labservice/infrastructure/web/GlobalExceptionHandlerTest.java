package com.mylab.labservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.mylab.labservice.domain.access.AccessAlreadyGrantedException;
import com.mylab.labservice.domain.batch.IncompleteBatchException;
import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.common.ResourceExhaustedException;
import com.mylab.labservice.domain.common.StaleSupersessionException;
import com.mylab.labservice.domain.common.UnauthenticatedException;
import com.mylab.labservice.domain.lineage.InvalidLineageException;
import com.mylab.labservice.domain.sample.SampleHasDerivedException;
import com.mylab.observability.CorrelationContext;
import com.mylab.observability.CorrelationContextHolder;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("status mapping")
    class StatusMapping {

        @Test
        @DisplayName("not found is 404")
        void notFound() {
            ProblemDetail result = handler.handleNotFound(new NotFoundException("Sample", UUID.randomUUID()));

            assertThat(result.getStatus()).isEqualTo(404);
            assertThat(result.getProperties()).containsEntry("code", "NOT_FOUND");
        }

        @Test
        @DisplayName("stale supersession is 409 with its own type")
        void staleSupersession() {
            ProblemDetail result = handler.handleStaleSupersession(new StaleSupersessionException(UUID.randomUUID()));

            assertThat(result.getStatus()).isEqualTo(409);
            assertThat(result.getType().toString()).endsWith("/stale-supersession");
        }

        @Test
        @DisplayName("lineage conflicts and duplicate grants are 409")
        void conflicts() {
            assertThat(handler.handleAlreadyExists(new InvalidLineageException("second head")).getStatus())
                    .isEqualTo(409);
            assertThat(handler.handleAlreadyExists(new AccessAlreadyGrantedException()).getProperties())
                    .containsEntry("code", "ACCESS_ALREADY_GRANTED");
            assertThat(handler.handleDuplicateKey(new DuplicateKeyException("uq")).getStatus()).isEqualTo(409);
        }

        @Test
        @DisplayName("an incomplete batch is an invalid transition")
        void incompleteBatch() {
            ProblemDetail result = handler.handleInvalidTransition(new IncompleteBatchException(UUID.randomUUID(), 2));

            assertThat(result.getStatus()).isEqualTo(409);
            assertThat(result.getProperties()).containsEntry("code", "INCOMPLETE_BATCH");
        }

        @Test
        @DisplayName("invalid data, including a sample with derived records, is 400")
        void invalidData() {
            assertThat(handler.handleInvalidData(new InvalidDataException("bad")).getStatus()).isEqualTo(400);
            assertThat(handler.handleInvalidData(new SampleHasDerivedException(3)).getProperties())
                    .containsEntry("code", "SAMPLE_HAS_DERIVED");
        }

        @Test
        @DisplayName("forbidden is 403 and unauthenticated is 401")
        void authErrors() {
            assertThat(handler.handleForbidden(new ForbiddenException("no")).getStatus()).isEqualTo(403);
            assertThat(handler.handleUnauthenticated(new UnauthenticatedException("who")).getStatus())
                    .isEqualTo(401);
        }

        @Test
        @DisplayName("pool exhaustion is 503 with Retry-After")
        void resourceExhausted() {
            ResponseEntity<ProblemDetail> result = handler.handleResourceExhausted(
                    new ResourceExhaustedException("pool exhausted", new RuntimeException()));

            assertThat(result.getStatusCode().value()).isEqualTo(503);
            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        }

        @Test
        @DisplayName("maps generic Exception to 500 without leaking the message")
        void generic() {
            ProblemDetail result = handler.handleGeneric(new RuntimeException("secret detail"));

            assertThat(result.getStatus()).isEqualTo(500);
            assertThat(result.getDetail()).doesNotContain("secret");
        }
    }

    @Test
    @DisplayName("an unreadable body surfaces the enum parse message")
    void unreadableBodyUsesInvalidDataCause() {
        var ex = new HttpMessageNotReadableException("JSON parse error",
                new InvalidDataException("Invalid status 'shipped'"), new MockHttpInputMessage(new byte[0]));

        ProblemDetail result = handler.handleUnreadable(ex);

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("Invalid status 'shipped'");
    }

    @Test
    @DisplayName("error body carries the envelope fields and correlation ID")
    void envelopeFields() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null, "req-1"));

        ProblemDetail result = handler.handleInvalidData(new InvalidDataException("name is required"));

        assertThat(result.getProperties())
                .containsEntry("success", false)
                .containsEntry("error", "name is required")
                .containsEntry("correlationId", "corr-1")
                .containsKey("timestamp");
    }
}
