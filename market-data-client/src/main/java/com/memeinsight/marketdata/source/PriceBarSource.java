package com.memeinsight.marketdata.source;

import com.memeinsight.common.model.PriceBar;
import reactor.core.publisher.Mono;

import java.util.List;

/** Daily OHLCV bars, oldest first. */
public interface PriceBarSource extends UpstreamSource {
    Mono<List<PriceBar>> fetchDailyBars(String symbol);
}
