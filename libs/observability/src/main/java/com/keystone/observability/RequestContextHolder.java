package com.keystone.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link RequestContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys declared on {@link RequestContext}; clearing it
 * removes them. Work handed to another thread (e.g. a data-access executor) loses both, so
 * callers wrap such work with {@link #propagate(Supplier)}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    /**
     * Sets the request context for the current thread and populates SLF4J MDC.
     *
     * @param context the context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(RequestContext.MDC_REQUEST_ID, context.requestId());
        setMdc(RequestContext.MDC_METHOD, context.method());
        setMdc(RequestContext.MDC_PATH, context.path());
    }

    /**
     * Returns the current thread's request context, if set.
     */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the request context and its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(RequestContext.MDC_REQUEST_ID);
        MDC.remove(RequestContext.MDC_METHOD);
        MDC.remove(RequestContext.MDC_PATH);
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever context the
     * thread had before (or clears it if there was none).
     *
     * @param context the context for the duration of the call
     * @param work    the work to execute
     * @return the value produced by {@code work}
     */
    public static <T> T callWithContext(RequestContext context, Supplier<T> work) {
        RequestContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the calling thread's context and returns a supplier that re-installs it around
     * {@code work} on whichever thread eventually runs it. Without a current context the work is
     * returned unchanged.
     *
     * @param work the work to hand off
     * @return a supplier that carries the caller's context
     */
    public static <T> Supplier<T> propagate(Supplier<T> work) {
        RequestContext captured = CONTEXT.get();
        if (captured == null) {
            return work;
        }
        return () -> callWithContext(captured, work);
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
