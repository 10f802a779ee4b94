package fr.lapetina.possibility.pool;

/**
 * Commands consumed by the pool loop.
 * The first group comes from callers, the second from streaming tasks.
 */
public enum PoolCommandType {
    INITIALIZE,
    QUEUE,
    CANCEL,
    RETRY,
    CLEAR,
    CANCEL_ALL,

    STREAM_OPENED,
    TOKEN,
    PROBABILITY,
    COMPLETED,
    FAILED,
    ABORTED
}
