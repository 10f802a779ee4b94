package fr.lapetina.possibility.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the transition table.
 *
 * @param from      source state
 * @param eventType event that triggers the transition
 * @param to        target state
 * @param guard     optional predicate; a transition whose guard fails is skipped
 * @param action    optional context update applied when the transition is taken
 */
public record StateTransition(
        GenerationState from,
        GenerationEventType eventType,
        GenerationState to,
        Guard guard,
        Action action
) {

    @FunctionalInterface
    public interface Guard {
        boolean test(GenerationContext context, GenerationEvent event);
    }

    @FunctionalInterface
    public interface Action {
        GenerationContext apply(GenerationContext context, GenerationEvent event, Instant now);
    }

    public StateTransition {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(to, "to is required");
    }

    public boolean matches(GenerationState state, GenerationEventType type) {
        return from == state && eventType == type;
    }

    public boolean allows(GenerationContext context, GenerationEvent event) {
        return guard == null || guard.test(context, event);
    }

    public GenerationContext apply(GenerationContext context, GenerationEvent event, Instant now) {
        return action == null ? context : action.apply(context, event, now);
    }

    @Override
    public String toString() {
        return from + " --" + eventType + "--> " + to;
    }
}
