package com.memeinsight.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.model.Post;
import com.memeinsight.marketdata.source.PostSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Hot listing of a subreddit through the OAuth API ({@code GET /r/{subreddit}/hot}).
 *
 * <p>The bearer token comes from configuration; obtaining it is out of scope. A missing
 * token is reported as an auth failure so the source gets suspended instead of being
 * hammered with anonymous calls.
 */
public class RedditPostClient implements PostSource {

    private static final Logger log = LoggerFactory.getLogger(RedditPostClient.class);

    public static final String SOURCE = "reddit";

    /** Listing page size accepted by the API. */
    public static final int MAX_POSTS_PER_SUBREDDIT = 100;

    /** Post bodies are cut to this many characters before extraction. */
    public static final int MAX_TEXT_CHARS = 2000;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String bearerToken;

    public RedditPostClient(WebClient redditWebClient, ObjectMapper objectMapper, String bearerToken) {
        this.webClient    = redditWebClient;
        this.objectMapper = objectMapper;
        this.bearerToken  = bearerToken;
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public Mono<List<Post>> fetchPosts(String subreddit, int limit) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Mono.error(new UpstreamAuthException(SOURCE, "no bearer token configured"));
        }
        int pageSize = Math.max(1, Math.min(limit, MAX_POSTS_PER_SUBREDDIT));
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/r/{subreddit}/hot")
                .queryParam("limit", pageSize)
                .queryParam("raw_json", 1)
                .build(subreddit))
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.fromResponse(SOURCE, response))
            .bodyToMono(String.class)
            .map(json -> parseListing(subreddit, json))
            .onErrorMap(e -> UpstreamErrors.translate(SOURCE, e))
            .doOnSuccess(posts -> log.info("Posts fetched. source={} subreddit={} count={}",
                SOURCE, subreddit, posts == null ? 0 : posts.size()));
    }

    List<Post> parseListing(String subreddit, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DataParseException(SOURCE, "listing for r/" + subreddit + " is not JSON", e);
        }
        JsonNode children = root.path("data").path("children");
        if (!children.isArray()) {
            throw new DataParseException(SOURCE, "listing for r/" + subreddit + " has no children");
        }

        List<Post> posts = new ArrayList<>();
        int skipped = 0;
        for (JsonNode child : children) {
            JsonNode d = child.path("data");
            String id = d.path("id").asText("");
            if (id.isEmpty() || !d.path("created_utc").isNumber()) {
                skipped++;
                continue;
            }
            if (d.path("stickied").asBoolean(false)) {
                continue;
            }
            posts.add(new Post(
                id,
                subreddit,
                d.path("title").asText(""),
                truncate(d.path("selftext").asText("")),
                d.path("score").asInt(0),
                Instant.ofEpochSecond(d.path("created_utc").asLong())));
        }
        if (skipped > 0) {
            log.warn("Skipped malformed posts. source={} subreddit={} skipped={}", SOURCE, subreddit, skipped);
        }
        return posts;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_TEXT_CHARS ? text : text.substring(0, MAX_TEXT_CHARS);
    }
}
