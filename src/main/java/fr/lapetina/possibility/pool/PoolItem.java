package fr.lapetina.possibility.pool;

import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.domain.model.PossibilityStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-possibility record held by the pool.
 * Immutable: every status change replaces the item in a new {@link PoolState}.
 */
public record PoolItem(
        PossibilityMetadata metadata,
        PossibilityStatus status,
        PossibilityResult result,
        String error,
        ErrorType errorType,
        CancellationHandle cancellationHandle,
        Instant loadingStartTime,
        Duration estimatedLoadTime
) {
    public PoolItem {
        Objects.requireNonNull(metadata, "Metadata is required");
        Objects.requireNonNull(status, "Status is required");
        if (estimatedLoadTime == null) {
            estimatedLoadTime = Duration.ZERO;
        }
    }

    public static PoolItem pending(PossibilityMetadata metadata, Duration estimatedLoadTime) {
        return new PoolItem(metadata, PossibilityStatus.PENDING, null, null, null, null, null, estimatedLoadTime);
    }

    public String id() {
        return metadata.id();
    }

    PoolItem loading(CancellationHandle handle, Instant now) {
        return new PoolItem(metadata, PossibilityStatus.LOADING, null, null, null, handle, now, estimatedLoadTime);
    }

    PoolItem streaming() {
        PossibilityResult initial = result != null ? result : PossibilityResult.empty(metadata);
        return new PoolItem(metadata, PossibilityStatus.STREAMING, initial, null, null,
                cancellationHandle, loadingStartTime, estimatedLoadTime);
    }

    PoolItem withResult(PossibilityResult newResult) {
        return new PoolItem(metadata, status, newResult, error, errorType,
                cancellationHandle, loadingStartTime, estimatedLoadTime);
    }

    PoolItem complete(Instant now) {
        PossibilityResult finalResult = (result != null ? result : PossibilityResult.empty(metadata)).completed(now);
        return new PoolItem(metadata, PossibilityStatus.COMPLETE, finalResult, null, null, null, null, estimatedLoadTime);
    }

    PoolItem failed(ErrorType type, String message) {
        return new PoolItem(metadata, PossibilityStatus.ERROR, result, message, type, null, null, estimatedLoadTime);
    }

    PoolItem cancelled() {
        return new PoolItem(metadata, PossibilityStatus.CANCELLED, result, null, null, null, null, estimatedLoadTime);
    }

    PoolItem reset() {
        return new PoolItem(metadata, PossibilityStatus.PENDING, null, null, null, null, null, estimatedLoadTime);
    }

    /**
     * Whether the given handle is the one owning this item's current dispatch.
     * Events from a superseded dispatch carry a stale handle and are ignored.
     */
    boolean isOwnedBy(CancellationHandle handle) {
        return handle != null && handle == cancellationHandle;
    }

    @Override
    public String toString() {
        return "PoolItem{" +
                "id='" + id() + '\'' +
                ", status=" + status +
                ", provider=" + metadata.provider() +
                ", model=" + metadata.model() +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
