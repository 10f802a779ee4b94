package fr.lapetina.possibility.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token for one in-flight possibility.
 *
 * The streaming task binds the resource it is blocked on (pending HTTP exchange,
 * open response body). Cancelling closes that resource, so the blocked read fails
 * promptly and the task observes {@link #isCancelled()} on its way out.
 *
 * Thread-safe: cancel is called from the pool loop, bind/release from the task thread.
 */
public final class CancellationHandle {

    private static final Logger log = LoggerFactory.getLogger(CancellationHandle.class);

    private final String possibilityId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Closeable> resource = new AtomicReference<>();

    CancellationHandle(String possibilityId) {
        this.possibilityId = possibilityId;
    }

    public String getPossibilityId() {
        return possibilityId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Aborts the bound resource. Idempotent.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        log.debug("Cancellation requested: possibilityId={}", possibilityId);
        closeQuietly(resource.getAndSet(null));
        return true;
    }

    /**
     * Binds the resource to close on cancellation.
     * If the handle was already cancelled the resource is closed immediately.
     */
    public void bind(Closeable closeable) {
        resource.set(closeable);
        if (cancelled.get()) {
            closeQuietly(resource.getAndSet(null));
        }
    }

    /**
     * Releases the bound resource. Called by the task on every exit path.
     */
    public void release() {
        closeQuietly(resource.getAndSet(null));
    }

    private void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error closing resource: possibilityId={}, error={}", possibilityId, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "CancellationHandle{" +
                "possibilityId='" + possibilityId + '\'' +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
