package fr.lapetina.possibility.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static fr.lapetina.possibility.lifecycle.GenerationEventType.*;
import static fr.lapetina.possibility.lifecycle.GenerationState.*;

/**
 * Transition table of the generation lifecycle, in evaluation order.
 */
public final class TransitionDefinitions {

    private TransitionDefinitions() {
    }

    /**
     * Builds the table for machines whose initial context uses {@code maxRetries}.
     * RESET restores a context with the same retry budget.
     */
    public static List<StateTransition> standard(int maxRetries) {
        List<StateTransition> table = new ArrayList<>();

        table.add(new StateTransition(IDLE, START_GENERATION, INITIALIZING, null,
                (ctx, event, now) -> {
                    GenerationEvent.StartGeneration start = (GenerationEvent.StartGeneration) event;
                    return ctx.startRound(start.requestId(), start.possibilityCount(), now);
                }));

        table.add(new StateTransition(INITIALIZING, GENERATION_INITIALIZED, GENERATING, null,
                (ctx, event, now) -> ctx.touch(now)));

        table.add(new StateTransition(GENERATING, STREAMING_STARTED, STREAMING, null,
                (ctx, event, now) -> ctx.withActiveStreams(
                        ((GenerationEvent.StreamingStarted) event).activeStreams(), now)));

        table.add(new StateTransition(STREAMING, TOKEN_RECEIVED, STREAMING, null,
                (ctx, event, now) -> ctx.touch(now)));

        table.add(new StateTransition(STREAMING, POSSIBILITY_COMPLETED, STREAMING, null,
                (ctx, event, now) -> ctx.withCompletedCount(ctx.completedCount() + 1, now)));

        table.add(new StateTransition(STREAMING, ALL_COMPLETED, COMPLETED,
                (ctx, event) -> ((GenerationEvent.AllCompleted) event).totalCompleted() == ctx.possibilityCount(),
                (ctx, event, now) -> ctx
                        .withCompletedCount(((GenerationEvent.AllCompleted) event).totalCompleted(), now)
                        .withActiveStreams(0, now)));

        for (GenerationState from : List.of(GENERATING, STREAMING)) {
            table.add(new StateTransition(from, ERROR_OCCURRED, FAILED,
                    (ctx, event) -> !((GenerationEvent.ErrorOccurred) event).retryable()
                            || ctx.retryAttempt() >= ctx.maxRetries(),
                    (ctx, event, now) -> ctx.withError(((GenerationEvent.ErrorOccurred) event).error(), now)));
        }

        for (GenerationState from : List.of(GENERATING, FAILED)) {
            table.add(new StateTransition(from, RETRY_GENERATION, INITIALIZING,
                    (ctx, event) -> ctx.retryAttempt() < ctx.maxRetries(),
                    (ctx, event, now) -> ctx.nextRetryAttempt(now)));
        }

        for (GenerationState from : List.of(GENERATING, STREAMING)) {
            table.add(new StateTransition(from, CANCEL_GENERATION, CANCELLED, null,
                    (ctx, event, now) -> ctx.withActiveStreams(0, now)));
        }

        for (GenerationState from : GenerationState.values()) {
            if (from != IDLE) {
                table.add(new StateTransition(from, RESET, IDLE, null,
                        (ctx, event, now) -> GenerationContext.initial(maxRetries)));
            }
        }

        return Collections.unmodifiableList(table);
    }

    public static List<StateTransition> standard() {
        return standard(GenerationContext.DEFAULT_MAX_RETRIES);
    }
}
