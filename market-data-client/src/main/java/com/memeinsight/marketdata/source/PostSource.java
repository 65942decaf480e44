package com.memeinsight.marketdata.source;

import com.memeinsight.common.model.Post;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Post stream of one community (subreddit). Implementations skip individual malformed
 * posts and fail the whole call only when the listing itself is unusable.
 */
public interface PostSource extends UpstreamSource {
    Mono<List<Post>> fetchPosts(String subreddit, int limit);
}
