package com.memeinsight.service.engine;

import com.memeinsight.common.model.PriceBar;
import com.memeinsight.common.model.ShortAvailability;

import java.util.List;

/**
 * Market data that arrived for one ticker this cycle. A null field means the fetch failed,
 * timed out or was skipped; the previous values are then kept.
 */
public record TickerMarketData(String symbol, List<PriceBar> bars, ShortAvailability shortAvailability) {}
