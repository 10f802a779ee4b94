/**
 * Bounded pool of streaming possibilities.
 *
 * <p>State changes are applied by a single LMAX Disruptor consumer; streaming runs on
 * worker threads that report back through the ring buffer. See
 * {@link fr.lapetina.possibility.pool.PossibilityPool} for the threading model.
 */
package fr.lapetina.possibility.pool;
