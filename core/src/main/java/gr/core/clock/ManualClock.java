package gr.core.clock;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic clock for tests. Also acts as a {@link Sleeper}: sleeping
 * advances the clock instead of blocking and the requested duration is recorded.
 */
public final class ManualClock implements Clock, Sleeper {
    private long now;
    private final List<Long> sleeps = new ArrayList<>();

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public synchronized long nowNanos() {
        return now;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public synchronized void setNanos(long value) {
        now = value;
    }

    @Override
    public synchronized void sleepNanos(long nanos) throws InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException("interrupted before sleep");
        if (nanos < 0) throw new IllegalArgumentException("nanos < 0");
        sleeps.add(nanos);
        now += nanos;
    }

    /**
     * Durations passed to {@link #sleepNanos(long)}, in call order.
     */
    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized long totalSleptNanos() {
        long total = 0;
        for (long s : sleeps) total += s;
        return total;
    }
}
