package gr.core.clock;

/**
 * Suspension point used by every blocking wait in the gate.
 *
 * Implementations may block the calling thread or, in tests, just move a
 * manual clock forward. Callers never hold a lock while suspended.
 * Interruption is the cancellation signal: an interrupted sleeper must throw
 * instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {
    void sleepNanos(long nanos) throws InterruptedException;
}
