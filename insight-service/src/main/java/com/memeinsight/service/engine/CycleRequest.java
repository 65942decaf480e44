package com.memeinsight.service.engine;

/**
 * What a cycle should cover: every tracked ticker, or a single one. Posts are always
 * read in full; the scope limits market-data fetching and re-scoring.
 */
public record CycleRequest(String symbol) {

    private static final CycleRequest ALL = new CycleRequest(null);

    public static CycleRequest all() {
        return ALL;
    }

    public static CycleRequest of(String symbol) {
        return symbol == null ? ALL : new CycleRequest(symbol);
    }

    public boolean isFull() {
        return symbol == null;
    }

    public boolean covers(String s) {
        return symbol == null || symbol.equals(s);
    }
}
