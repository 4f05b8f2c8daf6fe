package gr.core.clock;

/**
 * Production clock backed by System.nanoTime().
 * Monotonic within one JVM, which is all the token buckets need.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
