package fr.lapetina.possibility.lifecycle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable data of one generation round, owned by the state machine.
 * Transition actions return a modified copy through the {@code with*} methods.
 */
public record GenerationContext(
        String requestId,
        int possibilityCount,
        int completedCount,
        int activeStreams,
        List<Throwable> errors,
        int retryAttempt,
        int maxRetries,
        Instant startTime,
        Instant lastActivity
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public GenerationContext {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static GenerationContext initial(int maxRetries) {
        return new GenerationContext(null, 0, 0, 0, List.of(), 0, maxRetries, null, null);
    }

    public static GenerationContext initial() {
        return initial(DEFAULT_MAX_RETRIES);
    }

    public GenerationContext startRound(String newRequestId, int count, Instant now) {
        return new GenerationContext(newRequestId, count, 0, 0, List.of(), 0, maxRetries, now, now);
    }

    public GenerationContext touch(Instant now) {
        return new GenerationContext(requestId, possibilityCount, completedCount, activeStreams,
                errors, retryAttempt, maxRetries, startTime, now);
    }

    public GenerationContext withActiveStreams(int streams, Instant now) {
        return new GenerationContext(requestId, possibilityCount, completedCount, streams,
                errors, retryAttempt, maxRetries, startTime, now);
    }

    public GenerationContext withCompletedCount(int completed, Instant now) {
        return new GenerationContext(requestId, possibilityCount, completed, activeStreams,
                errors, retryAttempt, maxRetries, startTime, now);
    }

    public GenerationContext withError(Throwable error, Instant now) {
        if (error == null) {
            return touch(now);
        }
        List<Throwable> appended = new ArrayList<>(errors);
        appended.add(error);
        return new GenerationContext(requestId, possibilityCount, completedCount, activeStreams,
                appended, retryAttempt, maxRetries, startTime, now);
    }

    public GenerationContext nextRetryAttempt(Instant now) {
        return new GenerationContext(requestId, possibilityCount, completedCount, activeStreams,
                List.of(), retryAttempt + 1, maxRetries, startTime, now);
    }
}
