package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One social-media post (or comment) as delivered by the post-stream collaborator.
 * {@code score} is the post's karma; the engine drops posts below {@code minKarma}
 * before extraction.
 */
public record Post(
    @JsonProperty("id")        String id,
    @JsonProperty("subreddit") String subreddit,
    @JsonProperty("title")     String title,
    @JsonProperty("text")      String text,
    @JsonProperty("score")     int score,
    @JsonProperty("createdAt") Instant createdAt
) {

    /** Title and body joined, with either part allowed to be null. */
    public String fullText() {
        String t = title == null ? "" : title;
        String b = text == null ? "" : text;
        if (t.isEmpty()) return b;
        if (b.isEmpty()) return t;
        return t + " " + b;
    }
}
