package fr.lapetina.possibility.lifecycle;

/**
 * Event consumed by {@link GenerationLifecycleStateMachine}.
 *
 * Records do not validate in their constructors: payloads arrive from callers and
 * pool callbacks as-is, and {@link #isWellFormed()} is checked by the machine so a
 * malformed event is rejected instead of thrown.
 */
public sealed interface GenerationEvent
        permits GenerationEvent.StartGeneration,
                GenerationEvent.GenerationInitialized,
                GenerationEvent.StreamingStarted,
                GenerationEvent.TokenReceived,
                GenerationEvent.PossibilityCompleted,
                GenerationEvent.AllCompleted,
                GenerationEvent.ErrorOccurred,
                GenerationEvent.CancelGeneration,
                GenerationEvent.RetryGeneration,
                GenerationEvent.Reset {

    GenerationEventType type();

    default boolean isWellFormed() {
        return true;
    }

    record StartGeneration(String requestId, int possibilityCount) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.START_GENERATION;
        }

        @Override
        public boolean isWellFormed() {
            return requestId != null && !requestId.isBlank() && possibilityCount >= 0;
        }
    }

    record GenerationInitialized(String requestId) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.GENERATION_INITIALIZED;
        }
    }

    record StreamingStarted(String requestId, int activeStreams) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.STREAMING_STARTED;
        }

        @Override
        public boolean isWellFormed() {
            return activeStreams >= 0;
        }
    }

    record TokenReceived(String requestId, String possibilityId, String token) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.TOKEN_RECEIVED;
        }
    }

    record PossibilityCompleted(String requestId, String possibilityId) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.POSSIBILITY_COMPLETED;
        }

        @Override
        public boolean isWellFormed() {
            return possibilityId != null;
        }
    }

    record AllCompleted(String requestId, int totalCompleted) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.ALL_COMPLETED;
        }

        @Override
        public boolean isWellFormed() {
            return totalCompleted >= 0;
        }
    }

    /**
     * {@code error} may be null; the context then records no error.
     */
    record ErrorOccurred(String requestId, Throwable error, boolean retryable) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.ERROR_OCCURRED;
        }
    }

    record CancelGeneration(String requestId, String reason) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.CANCEL_GENERATION;
        }
    }

    record RetryGeneration(String requestId, int attempt) implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.RETRY_GENERATION;
        }

        @Override
        public boolean isWellFormed() {
            return attempt >= 0;
        }
    }

    record Reset() implements GenerationEvent {
        @Override
        public GenerationEventType type() {
            return GenerationEventType.RESET;
        }
    }
}
