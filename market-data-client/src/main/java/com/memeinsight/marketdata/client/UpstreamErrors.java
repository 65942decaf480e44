package com.memeinsight.marketdata.client;

import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.InsightException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamRateLimitedException;
import com.memeinsight.common.exception.UpstreamUnavailableException;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Maps HTTP statuses and transport failures onto the engine's exception taxonomy.
 *
 * <pre>
 *   401 / 403 → UpstreamAuthException
 *   429       → UpstreamRateLimitedException (Retry-After honoured when given in seconds)
 *   other 4xx/5xx, connect/read failures → UpstreamUnavailableException
 *   undecodable body → DataParseException
 * </pre>
 */
public final class UpstreamErrors {

    private UpstreamErrors() {}

    /** For {@code retrieve().onStatus(...)}: releases the body and yields the mapped exception. */
    public static Mono<? extends Throwable> fromResponse(String source, ClientResponse response) {
        int code = response.statusCode().value();
        return response.releaseBody().thenReturn(forStatus(source, code,
            response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER)));
    }

    /** For {@code exchangeToMono(...)} branches that must fail with the mapped exception. */
    public static <T> Mono<T> error(String source, ClientResponse response) {
        return fromResponse(source, response).flatMap(e -> Mono.<T>error(e));
    }

    public static InsightException forStatus(String source, int code, String retryAfterHeader) {
        if (code == 401 || code == 403) {
            return new UpstreamAuthException(source, "credentials rejected (HTTP " + code + ")");
        }
        if (code == 429) {
            return new UpstreamRateLimitedException(source, "rate limited (HTTP 429)", parseRetryAfter(retryAfterHeader));
        }
        return new UpstreamUnavailableException(source, "upstream answered HTTP " + code);
    }

    /** Translates errors that escaped status mapping; taxonomy exceptions pass through unchanged. */
    public static Throwable translate(String source, Throwable e) {
        if (e instanceof InsightException) {
            return e;
        }
        if (e instanceof DecodingException) {
            return new DataParseException(source, "undecodable response body", e);
        }
        if (e instanceof WebClientRequestException) {
            return new UpstreamUnavailableException(source, "request failed: " + e.getMessage(), e);
        }
        return new UpstreamUnavailableException(source, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(header.trim())));
        } catch (NumberFormatException e) {
            // HTTP-date form; the local back-off decides instead
            return Duration.ZERO;
        }
    }
}
