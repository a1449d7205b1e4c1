package com.mylab.labservice.infrastructure.web;

import com.mylab.labservice.domain.common.AlreadyExistsException;
import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import com.mylab.labservice.domain.common.LabException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.domain.common.ResourceExhaustedException;
import com.mylab.labservice.domain.common.StaleSupersessionException;
import com.mylab.labservice.domain.common.UnauthenticatedException;
import com.mylab.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Every body also carries {@code success=false}, {@code error}, {@code code}, {@code timestamp}
 * and {@code correlationId}:
 *
 * <pre>
 * {
 *   "type": "https://mylab.io/errors/stale-supersession",
 *   "title": "Conflict",
 *   "status": 409,
 *   "detail": "Analysis 6f1c... is no longer authoritative",
 *   "success": false,
 *   "error": "Analysis 6f1c... is no longer authoritative",
 *   "code": "STALE_SUPERSESSION",
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TYPE_BASE = "https://mylab.io/errors/";
    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(StaleSupersessionException.class)
    public ProblemDetail handleStaleSupersession(StaleSupersessionException ex) {
        log.warn("Stale supersession: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "stale-supersession", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(AlreadyExistsException.class)
    public ProblemDetail handleAlreadyExists(AlreadyExistsException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "already-exists", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidStateTransitionException ex) {
        log.warn("Rejected transition: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "invalid-state-transition", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(InvalidDataException.class)
    public ProblemDetail handleInvalidData(InvalidDataException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-data", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(ForbiddenException.class)
    public ProblemDetail handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        log.warn("Unauthenticated: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated", ex.getMessage(), ex.code());
    }

    @ExceptionHandler(ResourceExhaustedException.class)
    public ResponseEntity<ProblemDetail> handleResourceExhausted(ResourceExhaustedException ex) {
        log.warn("Resource exhausted: {}", ex.getMessage());
        return unavailable(ex.getMessage(), ex.code());
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ProblemDetail> handleConnectionFailure(RuntimeException ex) {
        log.warn("Database unavailable: {}", ex.getMessage());
        return unavailable("Database connection unavailable, retry later", "RESOURCE_EXHAUSTED");
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ProblemDetail handleDuplicateKey(DuplicateKeyException ex) {
        log.warn("Duplicate key: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "already-exists",
                "A record with the same unique key already exists", "ALREADY_EXISTS");
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ProblemDetail handleConcurrencyFailure(ConcurrencyFailureException ex) {
        log.warn("Concurrent update conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "concurrent-update",
                "The record was changed concurrently, retry the request", "CONCURRENT_UPDATE");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-data",
                "The request references missing or conflicting data", "INVALID_DATA");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail, "INVALID_DATA");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        InvalidDataException cause = findCause(ex, InvalidDataException.class);
        String detail = cause != null ? cause.getMessage() : "Malformed request body";
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-data", detail, "INVALID_DATA");
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ProblemDetail handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        InvalidDataException cause = findCause(ex, InvalidDataException.class);
        String detail = cause != null ? cause.getMessage() : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-data", detail, "INVALID_DATA");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage(), "INVALID_DATA");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred", "INTERNAL");
    }

    private ResponseEntity<ProblemDetail> unavailable(String detail, String code) {
        ProblemDetail body = problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "resource-exhausted",
                detail, code);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(body);
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail, String code) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("success", false);
        problem.setProperty("error", detail);
        problem.setProperty("code", code);
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        Throwable current = ex;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * Fallback for {@link LabException} subclasses without a dedicated handler.
     */
    @ExceptionHandler(LabException.class)
    public ProblemDetail handleLabException(LabException ex) {
        log.warn("Request failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage(), ex.code());
    }
}
