package com.bastion.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys declared on {@link CorrelationContext}; clearing
 * removes them. Servlet containers reuse request threads, so whoever calls {@link #set} must
 * call {@link #clear()} in a {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with {@code change.apply(current)}. Does nothing when no
     * context is set on this thread.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_SUBJECT_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }

    /**
     * Runs {@code runnable} with {@code context} installed, then restores the previous context
     * (or clears the thread if there was none). Used when admission work hops onto a pool thread.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        putOrRemove(CorrelationContext.MDC_SUBJECT_ID, ctx.subjectId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        putOrRemove(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        putOrRemove(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
