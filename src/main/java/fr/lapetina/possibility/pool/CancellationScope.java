package fr.lapetina.possibility.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Parent cancellation scope for one round.
 * Every item handle is a child; cancelling the scope cancels all live children.
 */
public final class CancellationScope {

    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final String name;
    private final Set<CancellationHandle> children = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationScope(String name) {
        this.name = name;
    }

    /**
     * Creates a child handle. A handle created after cancellation starts cancelled.
     */
    public CancellationHandle newHandle(String possibilityId) {
        CancellationHandle handle = new CancellationHandle(possibilityId);
        children.add(handle);
        if (cancelled.get()) {
            handle.cancel();
        }
        return handle;
    }

    /**
     * Forgets a child once its item left the active states.
     */
    public void detach(CancellationHandle handle) {
        if (handle != null) {
            children.remove(handle);
        }
    }

    /**
     * Cancels every live child.
     *
     * @return number of handles actually aborted
     */
    public int cancelAll() {
        cancelled.set(true);
        int aborted = 0;
        for (CancellationHandle handle : children) {
            if (handle.cancel()) {
                aborted++;
            }
        }
        children.clear();
        if (aborted > 0) {
            log.info("Cancellation scope aborted handles: scope={}, aborted={}", name, aborted);
        }
        return aborted;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int size() {
        return children.size();
    }

    public String getName() {
        return name;
    }
}
