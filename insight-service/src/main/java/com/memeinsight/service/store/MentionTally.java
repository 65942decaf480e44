package com.memeinsight.service.store;

/**
 * Mentions of one ticker found in one cycle's new posts. {@code sentimentCount} only
 * counts posts that carried a polarity.
 */
public record MentionTally(int mentions, double sentimentSum, int sentimentCount) {

    public static final MentionTally EMPTY = new MentionTally(0, 0.0, 0);

    public MentionTally add(double polarity, boolean scored) {
        return new MentionTally(mentions + 1,
            scored ? sentimentSum + polarity : sentimentSum,
            scored ? sentimentCount + 1 : sentimentCount);
    }
}
