package fr.lapetina.possibility.lifecycle;

import java.time.Duration;

/**
 * Derived view of the machine for progress displays.
 *
 * @param progress   completed / possibility count, 0 when nothing was requested
 * @param duration   time since the round started, null before START_GENERATION
 */
public record MachineStatus(
        GenerationState state,
        double progress,
        Duration duration,
        boolean active,
        boolean canRetry,
        int errorCount
) {
}
