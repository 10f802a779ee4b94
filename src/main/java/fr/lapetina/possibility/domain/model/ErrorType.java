package fr.lapetina.possibility.domain.model;

/**
 * Error taxonomy for possibility generation.
 * Drives both item bookkeeping and the retryable flag reported to the lifecycle.
 */
public enum ErrorType {
    /** Connection refused, reset, or other transport failure */
    NETWORK_ERROR(true),

    /** Connection could not be established in time */
    TIMEOUT(true),

    /** Generation endpoint rejected the request (4xx) */
    CLIENT_ERROR(false),

    /** Generation endpoint failed (5xx) */
    SERVER_ERROR(true),

    /** Explicit error event emitted by the provider inside the stream */
    PROVIDER_ERROR(false),

    /** Response body missing or unreadable */
    STREAM_ERROR(true),

    /** Internal system error */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
