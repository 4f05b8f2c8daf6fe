package gr.core.clock;

/**
 * Monotonic time source in nanoseconds.
 * Only differences between readings are meaningful.
 */
public interface Clock {
    long nowNanos();
}
