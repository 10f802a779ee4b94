package fr.lapetina.possibility.lifecycle;

/**
 * Discriminant of {@link GenerationEvent}.
 */
public enum GenerationEventType {
    START_GENERATION,
    GENERATION_INITIALIZED,
    STREAMING_STARTED,
    TOKEN_RECEIVED,
    POSSIBILITY_COMPLETED,
    ALL_COMPLETED,
    ERROR_OCCURRED,
    CANCEL_GENERATION,
    RETRY_GENERATION,
    RESET
}
