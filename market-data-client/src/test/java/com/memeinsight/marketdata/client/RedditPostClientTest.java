package com.memeinsight.marketdata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamRateLimitedException;
import com.memeinsight.common.exception.UpstreamUnavailableException;
import com.memeinsight.common.model.Post;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RedditPostClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String LISTING = """
        {"kind": "Listing", "data": {"children": [
          {"kind": "t3", "data": {"id": "abc1", "title": "GME to the moon", "selftext": "buy $GME",
                                  "score": 420, "created_utc": 1709287200.0}},
          {"kind": "t3", "data": {"id": "pin", "title": "Daily thread", "selftext": "",
                                  "score": 10, "created_utc": 1709280000.0, "stickied": true}},
          {"kind": "t3", "data": {"title": "no id here", "score": 1, "created_utc": 1709280000.0}}
        ]}}
        """;

    private static RedditPostClient client(StubExchange stub, String token) {
        return new RedditPostClient(stub.webClient(), MAPPER, token);
    }

    @Nested
    @DisplayName("listing parsing")
    class Parsing {

        @Test
        @DisplayName("maps posts and skips stickied and malformed entries")
        void parsesListing() {
            StubExchange stub = new StubExchange(HttpStatus.OK, LISTING);

            StepVerifier.create(client(stub, "tok").fetchPosts("wallstreetbets", 50))
                .assertNext(posts -> {
                    assertEquals(1, posts.size());
                    Post p = posts.get(0);
                    assertEquals("abc1", p.id());
                    assertEquals("wallstreetbets", p.subreddit());
                    assertEquals(420, p.score());
                    assertEquals(Instant.ofEpochSecond(1709287200L), p.createdAt());
                    assertEquals("GME to the moon buy $GME", p.fullText());
                })
                .verifyComplete();

            assertEquals("Bearer tok", stub.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
            String url = stub.lastRequest().url().toString();
            assertTrue(url.contains("/r/wallstreetbets/hot"), url);
            assertTrue(url.contains("limit=50"), url);
        }

        @Test
        @DisplayName("page size is capped at 100")
        void capsLimit() {
            StubExchange stub = new StubExchange(HttpStatus.OK, "{\"data\": {\"children\": []}}");
            StepVerifier.create(client(stub, "tok").fetchPosts("stocks", 500))
                .assertNext(posts -> assertTrue(posts.isEmpty()))
                .verifyComplete();
            assertTrue(stub.lastRequest().url().toString().contains("limit=100"));
        }

        @Test
        @DisplayName("long bodies are truncated")
        void truncates() {
            String body = "x".repeat(2500);
            String json = "{\"data\": {\"children\": [{\"data\": {\"id\": \"1\", \"title\": \"t\", \"selftext\": \""
                + body + "\", \"score\": 5, \"created_utc\": 1709287200}}]}}";
            StepVerifier.create(client(new StubExchange(HttpStatus.OK, json), "tok").fetchPosts("stocks", 10))
                .assertNext(posts -> assertEquals(RedditPostClient.MAX_TEXT_CHARS, posts.get(0).text().length()))
                .verifyComplete();
        }

        @Test
        @DisplayName("a listing without children is a parse error")
        void malformedListing() {
            StepVerifier.create(client(new StubExchange(HttpStatus.OK, "{\"error\": \"nope\"}"), "tok")
                    .fetchPosts("stocks", 10))
                .expectError(DataParseException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("status mapping")
    class Status {

        @Test
        @DisplayName("401 is an auth failure")
        void unauthorized() {
            StepVerifier.create(client(new StubExchange(HttpStatus.UNAUTHORIZED, "{}"), "tok").fetchPosts("stocks", 10))
                .expectError(UpstreamAuthException.class)
                .verify();
        }

        @Test
        @DisplayName("429 is a rate limit carrying Retry-After")
        void tooManyRequests() {
            StubExchange stub = new StubExchange(HttpStatus.TOO_MANY_REQUESTS, "{}", Map.of(HttpHeaders.RETRY_AFTER, "42"));
            StepVerifier.create(client(stub, "tok").fetchPosts("stocks", 10))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(UpstreamRateLimitedException.class, e);
                    assertEquals(Duration.ofSeconds(42), ((UpstreamRateLimitedException) e).getRetryAfter());
                })
                .verify();
        }

        @Test
        @DisplayName("5xx is an unavailable upstream")
        void serverError() {
            StepVerifier.create(client(new StubExchange(HttpStatus.BAD_GATEWAY, "{}"), "tok").fetchPosts("stocks", 10))
                .expectError(UpstreamUnavailableException.class)
                .verify();
        }

        @Test
        @DisplayName("a missing token fails without calling upstream")
        void missingToken() {
            StubExchange stub = new StubExchange(HttpStatus.OK, LISTING);
            StepVerifier.create(client(stub, " ").fetchPosts("stocks", 10))
                .expectError(UpstreamAuthException.class)
                .verify();
            assertTrue(stub.requests.isEmpty());
        }
    }
}
