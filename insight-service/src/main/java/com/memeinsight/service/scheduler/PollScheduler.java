package com.memeinsight.service.scheduler;

import com.memeinsight.common.model.InsightSnapshot;
import com.memeinsight.service.config.RuntimeSettings;
import com.memeinsight.service.engine.CycleRequest;
import com.memeinsight.service.engine.PollCoordinator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Adaptive poll loop:
 * <pre>
 *   delay(interval) → run cycle → pick next interval from the cycle status → repeat
 * </pre>
 *
 * <p>Each round is a fresh {@link Mono}; {@code Mono.delay} holds no thread while waiting.
 * The loop survives any cycle error by rescheduling with {@link PollTempo#fallback}.
 * On shutdown the pending delay is disposed and a running cycle is cancelled before its
 * commit, so the last published snapshot stays intact.
 */
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final PollCoordinator coordinator;
    private final RuntimeSettings settings;
    private final boolean enabled;
    private final Duration initialDelay;

    private final AtomicReference<Disposable> pending = new AtomicReference<>();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public PollScheduler(PollCoordinator coordinator, RuntimeSettings settings, boolean enabled,
                         Duration initialDelay) {
        this.coordinator  = coordinator;
        this.settings     = settings;
        this.enabled      = enabled;
        this.initialDelay = initialDelay;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Poll scheduler disabled; cycles run only on demand.");
            return;
        }
        log.info("Poll scheduler started. subreddits={} updateInterval={} initialDelaySeconds={}",
            settings.get().subreddits(), settings.get().updateInterval(), initialDelay.toSeconds());
        scheduleNext(initialDelay);
    }

    @PreDestroy
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        Disposable d = pending.getAndSet(null);
        if (d != null) d.dispose();
        boolean cancelled = coordinator.cancelRunningCycle();
        log.info("Poll scheduler stopped. runningCycleCancelled={}", cancelled);
    }

    private void scheduleNext(Duration delay) {
        if (stopped.get()) return;
        Disposable d = Mono.delay(delay)
            .then(coordinator.runCycle(CycleRequest.all()))
            .subscribe(
                this::onCycleDone,
                err -> {
                    Duration next = PollTempo.fallback(settings.get().updateInterval());
                    log.error("Poll cycle failed; rescheduling with fallback interval. nextIntervalSeconds={}",
                        next.toSeconds(), err);
                    scheduleNext(next);
                });
        pending.set(d);
    }

    private void onCycleDone(InsightSnapshot snapshot) {
        Duration next = PollTempo.resolve(snapshot.summary().status(), settings.get().updateInterval());
        log.info("POLL_TEMPO_SELECTED cycle={} status={} nextIntervalSeconds={}",
            snapshot.cycle(), snapshot.summary().status(), next.toSeconds());
        scheduleNext(next);
    }
}
