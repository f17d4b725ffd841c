package com.s1export.collector.fetch;

/**
 * Terminal state of one candidate's paginated retrieval.
 */
public enum RetrievalStatus {
    /** Last page reached, or pagination disabled. */
    COMPLETED(true, false),
    /** Stopped at the page ceiling with a cursor still pending. */
    TRUNCATED(true, false),
    /** Still 404 after the last attempt; the next candidate may have it. */
    NOT_FOUND(false, false),
    /** Transient faults outlasted the attempt budget. */
    RETRIES_EXHAUSTED(false, false),
    /** 401/403: no other candidate can help. */
    AUTH_FAILED(false, true),
    /** Unexpected fault such as an unreadable payload. */
    FATAL(false, true);

    private final boolean success;
    private final boolean abortsDataset;

    RetrievalStatus(boolean success, boolean abortsDataset) {
        this.success = success;
        this.abortsDataset = abortsDataset;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return whether the dataset must be given up without trying further candidates
     */
    public boolean abortsDataset() {
        return abortsDataset;
    }
}
