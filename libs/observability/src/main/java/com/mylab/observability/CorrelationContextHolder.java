package com.mylab.observability;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-local {@link CorrelationContext} mirrored into SLF4J MDC.
 * <p>
 * A request opens a scope when it enters the service; the caller's workspace and user are
 * attached once the session is resolved, so every later log line on the thread is tagged
 * with the tenant it acts for.
 *
 * <pre>{@code
 * try (CorrelationContextHolder.Scope ignored = CorrelationContextHolder.open(context)) {
 *     ...
 *     CorrelationContextHolder.attachCaller(workspaceId, userId);
 * }
 * }</pre>
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Installs {@code context} until the returned scope is closed; closing restores whatever
     * context the thread carried before.
     */
    public static Scope open(CorrelationContext context) {
        CorrelationContext previous = CURRENT.get();
        set(context);
        return () -> {
            if (previous == null) {
                clear();
            } else {
                set(previous);
            }
        };
    }

    /**
     * Replaces the context of the current thread.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        mdcEntries(context).forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Tags the open context with the resolved caller. Does nothing outside a scope.
     */
    public static void attachCaller(String workspaceId, String userId) {
        CorrelationContext current = CURRENT.get();
        if (current != null) {
            set(current.withCaller(workspaceId, userId));
        }
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    private static Map<String, String> mdcEntries(CorrelationContext context) {
        Map<String, String> entries = new HashMap<>();
        entries.put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        entries.put(CorrelationContext.MDC_TENANT_ID, context.workspaceId());
        entries.put(CorrelationContext.MDC_USER_ID, context.userId());
        entries.put(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        return entries;
    }

    /**
     * Restores the previous context when closed.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
