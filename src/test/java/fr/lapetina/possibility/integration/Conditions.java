package fr.lapetina.possibility.integration;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Polling waits for state changed by the pool loop thread.
 */
public final class Conditions {

    private static final long POLL_INTERVAL_MS = 10;

    private Conditions() {
    }

    /**
     * Waits until the condition holds.
     *
     * @throws AssertionError if the timeout elapses first
     */
    public static void waitUntil(Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            pause();
        }
    }

    /**
     * Re-runs the assertions until they pass, rethrowing the last failure on timeout.
     */
    public static void waitUntilAsserted(Duration timeout, Runnable assertions) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                assertions.run();
                return;
            } catch (AssertionError e) {
                if (System.nanoTime() > deadline) {
                    throw e;
                }
            }
            pause();
        }
    }

    private static void pause() {
        try {
            Thread.sleep(POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting", e);
        }
    }
}
