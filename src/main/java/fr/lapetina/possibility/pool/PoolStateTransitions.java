package fr.lapetina.possibility.pool;

import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.domain.model.PossibilityStatus;
import fr.lapetina.possibility.domain.model.Priority;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Pure state updates for the pool: each method reads an old {@link PoolState}
 * and returns a new one. Operations that do not apply return the input instance,
 * so callers can detect a no-op with an identity check.
 */
final class PoolStateTransitions {

    private PoolStateTransitions() {
    }

    static PoolState initialize(
            List<PossibilityMetadata> metadataList,
            Function<PossibilityMetadata, Duration> loadTimeEstimator
    ) {
        Map<String, PoolItem> items = new LinkedHashMap<>();
        for (PossibilityMetadata metadata : metadataList) {
            PoolItem previous = items.put(
                    metadata.id(),
                    PoolItem.pending(metadata, loadTimeEstimator.apply(metadata))
            );
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate possibility id: " + metadata.id());
            }
        }
        return new PoolState(items, List.of(), 0, items.size());
    }

    /**
     * HIGH goes to the front, LOW to the back, MEDIUM to the structural midpoint.
     */
    static PoolState enqueue(PoolState state, String id, Priority priority) {
        PoolItem item = state.items().get(id);
        if (item == null || item.status() != PossibilityStatus.PENDING || state.isQueued(id)) {
            return state;
        }

        List<String> queue = new ArrayList<>(state.queue());
        switch (priority) {
            case HIGH -> queue.add(0, id);
            case LOW -> queue.add(id);
            default -> queue.add(queue.size() / 2, id);
        }
        return new PoolState(state.items(), queue, state.loadingCount(), state.totalCount());
    }

    /**
     * Head of the queue if a slot is free, otherwise null.
     */
    static String nextDispatchable(PoolState state, int maxConcurrentConnections) {
        if (state.queue().isEmpty() || state.loadingCount() >= maxConcurrentConnections) {
            return null;
        }
        return state.queue().get(0);
    }

    /**
     * Pops the head id and moves its item PENDING -> LOADING, taking one slot.
     * A head whose item is no longer pending is dropped without taking a slot.
     */
    static PoolState dispatchHead(PoolState state, CancellationHandle handle, Instant now) {
        if (state.queue().isEmpty()) {
            return state;
        }
        String id = state.queue().get(0);
        List<String> queue = new ArrayList<>(state.queue().subList(1, state.queue().size()));
        PoolItem item = state.items().get(id);

        if (item == null || item.status() != PossibilityStatus.PENDING) {
            return new PoolState(state.items(), queue, state.loadingCount(), state.totalCount());
        }

        Map<String, PoolItem> items = new LinkedHashMap<>(state.items());
        items.put(id, item.loading(handle, now));
        return new PoolState(items, queue, state.loadingCount() + 1, state.totalCount());
    }

    static PoolState markStreaming(PoolState state, String id, CancellationHandle handle) {
        PoolItem item = state.items().get(id);
        if (item == null || item.status() != PossibilityStatus.LOADING || !item.isOwnedBy(handle)) {
            return state;
        }
        return replace(state, item.streaming(), 0);
    }

    static PoolState updateResult(
            PoolState state,
            String id,
            CancellationHandle handle,
            UnaryOperator<PossibilityResult> update
    ) {
        PoolItem item = state.items().get(id);
        if (item == null || !item.status().isActive() || !item.isOwnedBy(handle)) {
            return state;
        }
        PossibilityResult current = item.result() != null ? item.result() : PossibilityResult.empty(item.metadata());
        return replace(state, item.withResult(update.apply(current)), 0);
    }

    static PoolState complete(PoolState state, String id, CancellationHandle handle, Instant now) {
        PoolItem item = state.items().get(id);
        if (item == null || !item.status().isActive() || !item.isOwnedBy(handle)) {
            return state;
        }
        return replace(state, item.complete(now), -1);
    }

    static PoolState fail(PoolState state, String id, CancellationHandle handle, ErrorType type, String message) {
        PoolItem item = state.items().get(id);
        if (item == null || !item.status().isActive() || !item.isOwnedBy(handle)) {
            return state;
        }
        return replace(state, item.failed(type, message), -1);
    }

    /**
     * Cancels a non-terminal item: drops it from the queue and frees its slot if active.
     */
    static PoolState cancel(PoolState state, String id) {
        PoolItem item = state.items().get(id);
        if (item == null || item.status().isTerminal()) {
            return state;
        }
        List<String> queue = new ArrayList<>(state.queue());
        queue.remove(id);

        Map<String, PoolItem> items = new LinkedHashMap<>(state.items());
        items.put(id, item.cancelled());
        int loadingCount = item.status().isActive() ? state.loadingCount() - 1 : state.loadingCount();
        return new PoolState(items, queue, loadingCount, state.totalCount());
    }

    /**
     * ERROR or CANCELLED back to PENDING. The item is not re-queued.
     */
    static PoolState retry(PoolState state, String id) {
        PoolItem item = state.items().get(id);
        if (item == null || !item.status().isRetryable()) {
            return state;
        }
        return replace(state, item.reset(), 0);
    }

    private static PoolState replace(PoolState state, PoolItem item, int loadingDelta) {
        Map<String, PoolItem> items = new LinkedHashMap<>(state.items());
        items.put(item.id(), item);
        return new PoolState(items, state.queue(), state.loadingCount() + loadingDelta, state.totalCount());
    }
}
