package gr.engine.retry;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * <p>The wait after failed attempt {@code n} is
 * <pre>
 *   min(maxWait, minWait * multiplier^(n-1))
 * </pre>
 * so with the defaults (3 attempts, 2s, 10s, x2) a call that keeps failing
 * waits 2s, then 4s, then gives up. No jitter is added here.
 *
 * @param maxAttempts total attempts including the first (must be &gt;= 1)
 * @param minWait wait after the first failure (must be &gt;= 0)
 * @param maxWait upper bound for any single wait (must be &gt;= minWait)
 * @param multiplier growth factor between consecutive waits (must be &gt; 1)
 */
public record RetryPolicy(
    int maxAttempts,
    Duration minWait,
    Duration maxWait,
    double multiplier
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(10);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (minWait == null || minWait.isNegative()) {
            throw new IllegalArgumentException("minWait must be >= 0, got: " + minWait);
        }
        if (maxWait == null || maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException("maxWait must be >= minWait, got: " + maxWait);
        }
        if (!(multiplier > 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be > 1, got: " + multiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT, DEFAULT_MULTIPLIER);
    }

    public static RetryPolicy ofSeconds(int maxAttempts, double minWaitSeconds, double maxWaitSeconds, double multiplier) {
        return new RetryPolicy(maxAttempts, toDuration(minWaitSeconds), toDuration(maxWaitSeconds), multiplier);
    }

    /**
     * Wait to apply after attempt {@code failedAttempt} failed transiently.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got: " + failedAttempt);
        }
        long maxNanos = maxWait.toNanos();
        double nanos = minWait.toNanos() * Math.pow(multiplier, failedAttempt - 1);
        return nanos >= maxNanos ? maxWait : Duration.ofNanos((long) nanos);
    }

    private static Duration toDuration(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            throw new IllegalArgumentException("seconds must be >= 0, got: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
