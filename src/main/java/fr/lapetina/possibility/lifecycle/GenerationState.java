package fr.lapetina.possibility.lifecycle;

/**
 * Lifecycle state of a generation round.
 */
public enum GenerationState {
    /** No round in progress */
    IDLE,

    /** Round accepted, pool being prepared */
    INITIALIZING,

    /** Pool ready, requests being dispatched */
    GENERATING,

    /** At least one response stream is open */
    STREAMING,

    /** Every possibility completed */
    COMPLETED,

    /** Round failed (non-retryable error or retry budget exhausted) */
    FAILED,

    /** Round cancelled by the caller */
    CANCELLED;

    public boolean isActive() {
        return this == INITIALIZING || this == GENERATING || this == STREAMING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
