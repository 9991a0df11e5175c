package net.tilefetch.model.fetch;

/**
 * Final outcome of fetching one source location, after retries.
 */
public enum FetchStatus {
    SUCCESS,
    /** Explicit no-content answer, not an error. */
    EMPTY,
    /** Terminal, never retried. */
    NOT_FOUND,
    /** Retry budget exhausted without usable data. */
    TRANSIENT_FAILURE
}
