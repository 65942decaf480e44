package com.memeinsight.marketdata.source;

/** Common contract of every upstream collaborator: a stable name used for caching, quotas and suspension. */
public interface UpstreamSource {
    String sourceName();
}
