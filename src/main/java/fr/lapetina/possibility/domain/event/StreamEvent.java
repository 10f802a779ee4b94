package fr.lapetina.possibility.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed event read from a possibility stream.
 * One variant per {@code type} discriminant of the wire format.
 */
public sealed interface StreamEvent
        permits StreamEvent.Token,
                StreamEvent.Probability,
                StreamEvent.PossibilityComplete,
                StreamEvent.Error,
                StreamEvent.Done {

    StreamEventType type();

    /**
     * Whether this event ends the stream.
     */
    default boolean isTerminal() {
        return false;
    }

    record Token(String token) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TOKEN;
        }
    }

    record Probability(Double probability, JsonNode logprobs) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.PROBABILITY;
        }
    }

    record PossibilityComplete(String id) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.POSSIBILITY_COMPLETE;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Error(String message) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.ERROR;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Done() implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.DONE;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
