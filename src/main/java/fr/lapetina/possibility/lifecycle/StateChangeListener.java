package fr.lapetina.possibility.lifecycle;

/**
 * Notified synchronously after every accepted transition.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(GenerationState newState, GenerationState oldState,
                       GenerationContext context, GenerationEvent event);
}
