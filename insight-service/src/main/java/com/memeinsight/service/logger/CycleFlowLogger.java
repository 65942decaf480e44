package com.memeinsight.service.logger;

import com.memeinsight.common.model.MarketSummary;
import com.memeinsight.common.trace.CycleTrace;
import com.memeinsight.service.engine.CycleStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a poll cycle. Pure side effects; never alters the pipeline.
 *
 * <p>Stages in order:
 * <ol>
 *   <li>{@link #CYCLE_STARTED}      scheduler or API asked for a cycle</li>
 *   <li>{@link #POSTS_FETCHED}      subreddit listings arrived or were abandoned</li>
 *   <li>{@link #POSTS_DIGESTED}     tickers extracted and tallied</li>
 *   <li>{@link #MARKET_DATA_FETCHED} bars and short availability arrived or were abandoned</li>
 *   <li>{@link #CYCLE_COMMITTED}    store, registry and snapshot updated</li>
 * </ol>
 *
 * <p>In a reactive chain use {@code .doOnEach(flowLogger.stage(...))}, which reads the
 * trace id from the Reactor Context; elsewhere use {@link #logWithTraceId}.
 */
public class CycleFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CycleFlowLogger.class);

    public static final String CYCLE_STARTED       = "CYCLE_STARTED";
    public static final String POSTS_FETCHED       = "POSTS_FETCHED";
    public static final String POSTS_DIGESTED      = "POSTS_DIGESTED";
    public static final String MARKET_DATA_FETCHED = "MARKET_DATA_FETCHED";
    public static final String CYCLE_COMMITTED     = "CYCLE_COMMITTED";
    public static final String CYCLE_CANCELLED     = "CYCLE_CANCELLED";

    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = CycleTrace.traceId(signal.getContextView());
            String scope = CycleTrace.scope(signal.getContextView());
            CycleTrace.log(traceId, () ->
                log.info("[CycleFlow] stage={} scope={} traceId={}", stageName, scope, traceId));
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        CycleTrace.log(traceId, () ->
            log.info("[CycleFlow] stage={} traceId={}", stageName, traceId));
    }

    /** One line per committed cycle: status, volumes and every degrade counter. */
    public void logCommitted(long cycle, MarketSummary summary, int tracked, CycleStats stats, String traceId) {
        CycleTrace.log(traceId, () ->
            log.info("[CycleFlow] stage={} cycle={} status={} tracked={} postsProcessed={} postsSkipped={} "
                     + "mentions={} {} traceId={}",
                     CYCLE_COMMITTED, cycle, summary.status(), tracked, summary.postsProcessed(),
                     summary.postsSkipped(), summary.totalMentions(), stats, traceId));
    }
}
