package fr.lapetina.possibility.pool;

/**
 * Observer of item changes, called on the pool loop thread.
 *
 * A listener may call pool operations; they are applied inline.
 * It must not block waiting for another thread that uses the pool.
 */
@FunctionalInterface
public interface PoolListener {

    /**
     * @param previous item before the change
     * @param current  item after the change
     */
    void onItemUpdated(PoolItem previous, PoolItem current);
}
