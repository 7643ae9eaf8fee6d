package com.forecastalpha.analysis.web;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-request metadata bound to the handling thread by {@link TraceIdFilter}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String method, String path, Instant startedAt) {

        public Duration elapsed() {
            return Duration.between(startedAt, Instant.now());
        }
    }
}
