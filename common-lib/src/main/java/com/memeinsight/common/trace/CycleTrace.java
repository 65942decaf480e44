package com.memeinsight.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Identity of the poll cycle a piece of work belongs to: its trace id and its scope
 * ({@code all} or the single ticker being refreshed).
 *
 * <p>Both live in the Reactor Context of the cycle pipeline, so fetches started deep inside
 * it (the fetch cache included) can tag their log lines. MDC mirrors them, plus the
 * upstream source when there is one, only while a single log statement runs.
 */
public final class CycleTrace {

    public static final String TRACE_ID = "traceId";
    public static final String SCOPE    = "scope";
    public static final String SOURCE   = "source";

    private static final String UNKNOWN = "unknown";

    private CycleTrace() {}

    /** Binds {@code traceId} and {@code scope} to {@code cycle}; call at the end of assembly. */
    public static <T> Mono<T> bind(Mono<T> cycle, String traceId, String scope) {
        return cycle.contextWrite(ctx -> ctx.put(TRACE_ID, traceId).put(SCOPE, scope));
    }

    public static String traceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID, UNKNOWN);
    }

    public static String scope(ContextView ctx) {
        return ctx.getOrDefault(SCOPE, UNKNOWN);
    }

    public static void log(String traceId, Runnable logAction) {
        log(traceId, null, logAction);
    }

    /** Runs {@code logAction} with the trace id and, when given, the source in MDC. */
    public static void log(String traceId, String source, Runnable logAction) {
        MDC.put(TRACE_ID, traceId);
        if (source != null) {
            MDC.put(SOURCE, source);
        }
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID);
            MDC.remove(SOURCE);
        }
    }

    /** Same as {@link #log(String, String, Runnable)} with the trace id read from {@code ctx}. */
    public static void log(ContextView ctx, String source, Runnable logAction) {
        log(traceId(ctx), source, logAction);
    }
}
