package gr.engine.limiter;

import gr.core.clock.Clock;

import java.time.Duration;

/**
 * Absolute bound on how long {@link DualBudgetRateLimiter#acquire} may block,
 * expressed on the limiter's clock. Retry backoff is not counted against it.
 *
 * @param atNanos clock reading after which waiting must stop (ignored when unbounded)
 * @param bounded false for "wait as long as it takes"
 */
public record Deadline(long atNanos, boolean bounded) {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    public static Deadline none() {
        return NONE;
    }

    public static Deadline at(long atNanos) {
        return new Deadline(atNanos, true);
    }

    public static Deadline after(Clock clock, Duration timeout) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        long now = clock.nowNanos();
        long timeoutNanos = saturatedNanos(timeout);
        long at = now + timeoutNanos;
        // saturate instead of wrapping for very long timeouts; now may be negative
        if (((now ^ at) & (timeoutNanos ^ at)) < 0) {
            at = Long.MAX_VALUE;
        }
        return new Deadline(at, true);
    }

    /**
     * Time left before the deadline, never negative; {@code Long.MAX_VALUE} when unbounded.
     */
    public long remainingNanos(Clock clock) {
        if (!bounded || atNanos == Long.MAX_VALUE) return Long.MAX_VALUE;
        long now = clock.nowNanos();
        long remaining = atNanos - now;
        if (((atNanos ^ now) & (atNanos ^ remaining)) < 0) {
            // difference does not fit in a long
            return atNanos > now ? Long.MAX_VALUE : 0L;
        }
        return Math.max(0L, remaining);
    }

    private static long saturatedNanos(Duration timeout) {
        return timeout.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : timeout.toNanos();
    }

    public boolean isExpired(Clock clock) {
        return bounded && remainingNanos(clock) == 0L;
    }
}
