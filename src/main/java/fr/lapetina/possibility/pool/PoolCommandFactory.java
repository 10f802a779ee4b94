package fr.lapetina.possibility.pool;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the pool loop's ring buffer slots.
 */
public final class PoolCommandFactory implements EventFactory<PoolCommand> {

    @Override
    public PoolCommand newInstance() {
        return new PoolCommand();
    }
}
