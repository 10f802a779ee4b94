package fr.lapetina.possibility.domain.model;

/**
 * Lifecycle status of a single possibility in the pool.
 */
public enum PossibilityStatus {
    /** Created, waiting to be queued or dispatched */
    PENDING,

    /** Dispatched, request sent, response body not yet readable */
    LOADING,

    /** Response body open, tokens arriving */
    STREAMING,

    /** Stream finished normally */
    COMPLETE,

    /** Request or stream failed */
    ERROR,

    /** Aborted by the caller */
    CANCELLED;

    /**
     * Occupies a concurrency slot.
     */
    public boolean isActive() {
        return this == LOADING || this == STREAMING;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }

    public boolean isRetryable() {
        return this == ERROR || this == CANCELLED;
    }
}
