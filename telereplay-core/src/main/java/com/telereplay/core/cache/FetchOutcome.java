package com.telereplay.core.cache;

/**
 * Result of executing a {@link FetchRequest}.
 */
public enum FetchOutcome {
    /** Every chunk of the requested range was fetched and merged */
    COMPLETED,

    /** A chunk failed; chunks before it were merged, the rest is retried on the next cycle */
    FAILED,

    /** The archive holds no such series; the topic shall be dropped */
    SERIES_NOT_FOUND,

    /** Interrupted while waiting for the topic lock or between chunks */
    CANCELLED
}
