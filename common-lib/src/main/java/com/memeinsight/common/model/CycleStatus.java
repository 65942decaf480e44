package com.memeinsight.common.model;

/** Outcome of one poll cycle as reported in the market summary. */
public enum CycleStatus {
    /** Every source answered within its timeout. */
    SUCCESS,
    /** At least one source or ticker degraded; the rest was committed. */
    PARTIAL,
    /** The global cycle timeout fired; whatever had arrived was committed. */
    TIMEOUT,
    /** No posts could be read at all; only market data was refreshed. */
    FAILED,
    /** No cycle has completed yet. */
    PENDING
}
