package com.mylab.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Traces operations on a single lab object. Each span names the object it acts on and carries
 * the tenant of the open {@link CorrelationContext}, so traces can be filtered per workspace.
 * Exporter and SDK setup belong to the application.
 */
public final class SpanHelper {

    static final AttributeKey<String> OBJECT_TYPE = AttributeKey.stringKey("lab.object.type");
    static final AttributeKey<String> OBJECT_ID = AttributeKey.stringKey("lab.object.id");
    static final AttributeKey<String> CORRELATION_ID = AttributeKey.stringKey("lab.correlation_id");
    static final AttributeKey<String> WORKSPACE_ID = AttributeKey.stringKey("lab.workspace_id");
    static final AttributeKey<String> USER_ID = AttributeKey.stringKey("lab.user_id");
    static final AttributeKey<String> FAILURE = AttributeKey.stringKey("lab.failure");

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public <T> T traced(String operation, String objectType, Object objectId, Supplier<T> work) {
        return traced(operation, objectType, objectId, Map.of(), work);
    }

    /**
     * Runs {@code work} in an internal span named {@code operation}.
     * <p>
     * A runtime exception ends the span in error with the exception recorded and its simple class
     * name under {@code lab.failure}, then propagates unchanged.
     *
     * @param objectType wire name of the object type, e.g. {@code sample}
     * @param objectId   ID of the object, rendered with {@code toString()}; may be null for creates
     * @param attributes extra string attributes, keys used as given
     */
    public <T> T traced(String operation, String objectType, Object objectId,
                        Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(operation)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(OBJECT_TYPE, objectType);
        if (objectId != null) {
            builder.setAttribute(OBJECT_ID, objectId.toString());
        }
        attributes.forEach(builder::setAttribute);
        CorrelationContextHolder.get().ifPresent(ctx -> tagCaller(builder, ctx));

        Span span = builder.startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setAttribute(FAILURE, e.getClass().getSimpleName());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private static void tagCaller(SpanBuilder builder, CorrelationContext ctx) {
        builder.setAttribute(CORRELATION_ID, ctx.correlationId());
        if (ctx.workspaceId() != null) {
            builder.setAttribute(WORKSPACE_ID, ctx.workspaceId());
        }
        if (ctx.userId() != null) {
            builder.setAttribute(USER_ID, ctx.userId());
        }
    }
}
