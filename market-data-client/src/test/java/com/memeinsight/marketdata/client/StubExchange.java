package com.memeinsight.marketdata.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Canned-response WebClient that records every request it receives. */
final class StubExchange {

    final List<ClientRequest> requests = new ArrayList<>();

    private final HttpStatus status;
    private final String body;
    private final Map<String, String> headers;

    StubExchange(HttpStatus status, String body) {
        this(status, body, Map.of());
    }

    StubExchange(HttpStatus status, String body, Map<String, String> headers) {
        this.status = status;
        this.body = body;
        this.headers = headers;
    }

    WebClient webClient() {
        return WebClient.builder()
            .baseUrl("https://upstream.test")
            .exchangeFunction(request -> {
                requests.add(request);
                ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body);
                headers.forEach((name, value) -> response.header(name, value));
                return Mono.just(response.build());
            })
            .build();
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
