package fr.lapetina.possibility.pool;

/**
 * Aggregate counters of a pool snapshot.
 *
 * @param completed items in COMPLETE
 * @param loading   items in LOADING or STREAMING
 * @param pending   items in PENDING
 * @param error     items in ERROR or CANCELLED
 * @param total     total items in the round
 */
public record LoadingStats(
        int completed,
        int loading,
        int pending,
        int error,
        int total
) {
    public static LoadingStats empty() {
        return new LoadingStats(0, 0, 0, 0, 0);
    }

    public boolean isFinished() {
        return total > 0 && loading == 0 && pending == 0;
    }
}
