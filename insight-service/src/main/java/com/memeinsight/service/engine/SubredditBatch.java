package com.memeinsight.service.engine;

import com.memeinsight.common.model.Post;

import java.util.List;

/** Posts of one subreddit in one cycle; {@code ok} is false when the fetch failed. */
public record SubredditBatch(String subreddit, List<Post> posts, boolean ok) {

    public static SubredditBatch failed(String subreddit) {
        return new SubredditBatch(subreddit, List.of(), false);
    }
}
