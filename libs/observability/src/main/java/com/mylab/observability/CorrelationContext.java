package com.mylab.observability;

/**
 * Identifiers that follow one request through logs, metrics and spans.
 *
 * @param correlationId ID of the business flow, propagated through {@code X-Correlation-ID}
 * @param workspaceId   workspace of the caller (nullable until the caller is resolved)
 * @param userId        caller (nullable for system work)
 * @param requestId     ID of this specific request
 */
public record CorrelationContext(
        String correlationId,
        String workspaceId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String MDC_TENANT_ID = "tenantId";

    public static final String MDC_USER_ID = "userId";

    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy carrying the resolved caller.
     */
    public CorrelationContext withCaller(String workspaceId, String userId) {
        return new CorrelationContext(correlationId, workspaceId, userId, requestId);
    }
}
