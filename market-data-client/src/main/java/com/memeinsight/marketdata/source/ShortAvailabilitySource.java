package com.memeinsight.marketdata.source;

import com.memeinsight.common.model.ShortAvailability;
import reactor.core.publisher.Mono;

public interface ShortAvailabilitySource extends UpstreamSource {
    Mono<ShortAvailability> fetchShortAvailability(String symbol);
}
