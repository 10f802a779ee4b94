package fr.lapetina.possibility.pool;

import fr.lapetina.possibility.domain.model.PossibilityStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the pool.
 *
 * Items keep initialization order. The queue holds ids of PENDING items,
 * head first. Instances are only produced by {@link PoolStateTransitions}.
 */
public record PoolState(
        Map<String, PoolItem> items,
        List<String> queue,
        int loadingCount,
        int totalCount
) {
    private static final PoolState EMPTY = new PoolState(Map.of(), List.of(), 0, 0);

    public PoolState {
        items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        queue = List.copyOf(queue);
    }

    public static PoolState empty() {
        return EMPTY;
    }

    public Optional<PoolItem> item(String id) {
        return Optional.ofNullable(items.get(id));
    }

    public boolean isQueued(String id) {
        return queue.contains(id);
    }

    /**
     * Counts items per status. Every status is present in the result.
     */
    public Map<PossibilityStatus, Integer> countByStatus() {
        Map<PossibilityStatus, Integer> counts = new EnumMap<>(PossibilityStatus.class);
        for (PossibilityStatus status : PossibilityStatus.values()) {
            counts.put(status, 0);
        }
        for (PoolItem item : items.values()) {
            counts.merge(item.status(), 1, Integer::sum);
        }
        return counts;
    }

    public LoadingStats stats() {
        Map<PossibilityStatus, Integer> counts = countByStatus();
        return new LoadingStats(
                counts.get(PossibilityStatus.COMPLETE),
                counts.get(PossibilityStatus.LOADING) + counts.get(PossibilityStatus.STREAMING),
                counts.get(PossibilityStatus.PENDING),
                counts.get(PossibilityStatus.ERROR) + counts.get(PossibilityStatus.CANCELLED),
                totalCount
        );
    }

    /**
     * True when every item reached COMPLETE, ERROR or CANCELLED.
     */
    public boolean allTerminal() {
        return !items.isEmpty() && items.values().stream().allMatch(i -> i.status().isTerminal());
    }
}
