package gr.core.clock;

import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread. Thread interruption aborts the sleep.
 */
public final class ThreadSleeper implements Sleeper {
    private static final ThreadSleeper INSTANCE = new ThreadSleeper();

    public static ThreadSleeper instance() {
        return INSTANCE;
    }

    @Override
    public void sleepNanos(long nanos) throws InterruptedException {
        if (nanos <= 0) {
            if (Thread.interrupted()) throw new InterruptedException("interrupted before sleep");
            return;
        }
        TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
