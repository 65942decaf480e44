package com.memeinsight.service.registry;

import com.memeinsight.common.likelihood.LikelihoodBaselines;
import com.memeinsight.common.model.SubScores;
import com.memeinsight.common.model.TickerSnapshot;
import com.memeinsight.common.stage.StageState;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Engine-side state of one tracked ticker. Immutable; the coordinator replaces the
 * record in the {@link TickerRegistry} once per cycle.
 *
 * @param firstSeenPrice    first close observed after the record was created, null until then
 * @param lastQualifyingDay last calendar day whose mention count reached {@code minPosts}
 * @param shortInterestPct  last known short interest, retained when a fetch fails
 */
public record TickerRecord(
    String              symbol,
    String              displayName,
    Instant             firstSeen,
    Instant             lastSeen,
    LocalDate           lastQualifyingDay,
    Double              firstSeenPrice,
    Double              latestClose,
    boolean             shortable,
    Double              shortInterestPct,
    int                 mentionCount,
    SubScores           subScores,
    double              impactScore,
    double              memeLikelihood,
    LikelihoodBaselines baselines,
    StageState          stageState
) {

    public static TickerRecord create(String symbol, String displayName, Instant now, LocalDate today,
                                      double priorLikelihood) {
        return new TickerRecord(symbol, displayName, now, now, today, null, null, false, null, 0,
            SubScores.neutral(), 50.0, priorLikelihood, LikelihoodBaselines.initial(), StageState.initial(now));
    }

    /** Whole days between first sighting and {@code now}. */
    public long daysActive(Instant now) {
        return Math.max(0, ChronoUnit.DAYS.between(firstSeen, now));
    }

    public Double priceSinceStartPct() {
        if (firstSeenPrice == null || latestClose == null || firstSeenPrice <= 0.0) {
            return null;
        }
        return (latestClose - firstSeenPrice) / firstSeenPrice * 100.0;
    }

    public TickerSnapshot toSnapshot(Instant now) {
        return new TickerSnapshot(
            symbol,
            displayName,
            impactScore,
            memeLikelihood,
            stageState.stage(),
            shortable,
            stageState.declineFlag(),
            (int) daysActive(now),
            subScores.volume().value(),
            subScores.sentiment().value(),
            subScores.momentum().value(),
            subScores.shortInterest().value(),
            mentionCount,
            priceSinceStartPct(),
            lastSeen);
    }
}
