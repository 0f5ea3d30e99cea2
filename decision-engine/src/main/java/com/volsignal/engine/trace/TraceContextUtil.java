package com.volsignal.engine.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the per-request trace id through the reactive evaluation chain.
 *
 * <p>The Reactor Context holds the trace id; MDC sees it only while a log
 * statement runs, so no ThreadLocal state leaks across scheduler threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(evaluation, traceId);
 *     ...
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String SYMBOL_KEY   = "symbol";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Header value when present, else a fresh random id. */
    public static String resolveTraceId(String headerValue) {
        return headerValue != null && !headerValue.isBlank()
            ? headerValue.trim()
            : UUID.randomUUID().toString();
    }

    /**
     * Writes {@code traceId} into the Reactor Context of {@code mono}. Context
     * propagates upstream at subscription, so apply it last.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, {@code "unknown"} when absent. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with the trace id in MDC, then clears it. */
    public static void withMdc(String traceId, Runnable logAction) {
        withMdc(traceId, null, logAction);
    }

    /** Same, also exposing the symbol under evaluation. */
    public static void withMdc(String traceId, String symbol, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN);
        if (symbol != null) MDC.put(SYMBOL_KEY, symbol);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SYMBOL_KEY);
        }
    }
}
