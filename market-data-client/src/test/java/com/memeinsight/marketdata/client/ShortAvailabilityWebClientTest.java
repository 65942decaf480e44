package com.memeinsight.marketdata.client;

import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.model.ShortAvailability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

class ShortAvailabilityWebClientTest {

    @Test
    @DisplayName("maps the provider payload")
    void parses() {
        String body = "{\"symbol\": \"GME\", \"shortable\": true, \"shortInterestPct\": 21.5}";
        StepVerifier.create(new ShortAvailabilityWebClient(new StubExchange(HttpStatus.OK, body).webClient())
                .fetchShortAvailability("GME"))
            .expectNext(new ShortAvailability("GME", true, 21.5))
            .verifyComplete();
    }

    @Test
    @DisplayName("unknown symbols are not shortable and carry no figure")
    void notFound() {
        StepVerifier.create(new ShortAvailabilityWebClient(new StubExchange(HttpStatus.NOT_FOUND, "{}").webClient())
                .fetchShortAvailability("XYZ"))
            .expectNext(ShortAvailability.unknown("XYZ"))
            .verifyComplete();
    }

    @Test
    @DisplayName("403 is an auth failure")
    void forbidden() {
        StepVerifier.create(new ShortAvailabilityWebClient(new StubExchange(HttpStatus.FORBIDDEN, "{}").webClient())
                .fetchShortAvailability("GME"))
            .expectError(UpstreamAuthException.class)
            .verify();
    }
}
