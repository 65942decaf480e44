package com.memeinsight.marketdata.client;

import com.memeinsight.common.model.ShortAvailability;
import com.memeinsight.marketdata.model.ShortAvailabilityResponse;
import com.memeinsight.marketdata.source.ShortAvailabilitySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Generic short-availability endpoint: {@code GET /short-availability/{symbol}} returning
 * {@code {symbol, shortable, shortInterestPct}}. A 404 means the provider does not know
 * the symbol and is reported as "not shortable, no figure".
 */
public class ShortAvailabilityWebClient implements ShortAvailabilitySource {

    private static final Logger log = LoggerFactory.getLogger(ShortAvailabilityWebClient.class);

    public static final String SOURCE = "short-availability";

    private final WebClient webClient;

    public ShortAvailabilityWebClient(WebClient shortAvailabilityWebClient) {
        this.webClient = shortAvailabilityWebClient;
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public Mono<ShortAvailability> fetchShortAvailability(String symbol) {
        return webClient.get()
            .uri("/short-availability/{symbol}", symbol)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().thenReturn(ShortAvailability.unknown(symbol));
                }
                if (response.statusCode().isError()) {
                    return UpstreamErrors.<ShortAvailability>error(SOURCE, response);
                }
                return response.bodyToMono(ShortAvailabilityResponse.class)
                    .map(body -> new ShortAvailability(symbol,
                        Boolean.TRUE.equals(body.shortable()), body.shortInterestPct()))
                    .defaultIfEmpty(ShortAvailability.unknown(symbol));
            })
            .onErrorMap(e -> UpstreamErrors.translate(SOURCE, e))
            .doOnSuccess(sa -> log.debug("Short availability fetched. source={} symbol={} shortable={}",
                SOURCE, symbol, sa != null && sa.shortable()));
    }
}
