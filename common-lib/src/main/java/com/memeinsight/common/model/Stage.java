package com.memeinsight.common.model;

/**
 * Lifecycle stage of a tracked ticker. Transitions are owned by
 * {@link com.memeinsight.common.stage.StageClassifier}.
 */
public enum Stage {
    START("Start"),
    RISING_INTEREST("Rising Interest"),
    STOCK_RISING("Stock Rising"),
    WITHIN_ESTIMATED_PEAK("Within Estimated Peak"),
    DO_NOT_BUY("DO NOT BUY"),
    DROPPING("Dropping");

    private final String displayName;

    Stage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** {@code DROPPING} ends the activity window; only eviction resets it. */
    public boolean isTerminal() {
        return this == DROPPING;
    }

    public boolean isDeclining() {
        return this == DO_NOT_BUY || this == DROPPING;
    }
}
