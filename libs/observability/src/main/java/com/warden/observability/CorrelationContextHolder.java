package com.warden.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context copies every non-null field into the MDC; clearing removes all keys.
 * Work handed to another thread (for example audit writes) must carry the context explicitly
 * through {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and populates the MDC.
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
     * Returns the current correlation id, or null when no context is bound.
     */
    public static String currentCorrelationId() {
        CorrelationContext ctx = CONTEXT.get();
        return ctx != null ? ctx.correlationId() : null;
    }

    /**
     * Replaces the bound context with an updated copy. No-op when nothing is bound.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs the task with the given context bound, then restores whatever was bound before.
     * A null context runs the task with no context at all.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            bindOrClear(context);
            runnable.run();
        } finally {
            bindOrClear(previous);
        }
    }

    /**
     * Callable variant of {@link #runWithContext(CorrelationContext, Runnable)}.
     */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable) throws Exception {
        CorrelationContext previous = CONTEXT.get();
        try {
            bindOrClear(context);
            return callable.call();
        } finally {
            bindOrClear(previous);
        }
    }

    private static void bindOrClear(CorrelationContext context) {
        if (context != null) {
            set(context);
        } else {
            clear();
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_SESSION_ID, ctx.sessionId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_CLIENT_IP, ctx.clientIp());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_SESSION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_CLIENT_IP);
    }
}
