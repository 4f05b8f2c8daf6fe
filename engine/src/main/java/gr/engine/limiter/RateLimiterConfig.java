package gr.engine.limiter;

/**
 * Sizing of the two token buckets owned by a {@link DualBudgetRateLimiter}.
 *
 * @param countCapacity maximum calls held in the count budget
 * @param countRefillPerSecond calls restored per second
 * @param throughputCapacity maximum units held in the throughput budget
 * @param throughputRefillPerSecond units restored per second
 */
public record RateLimiterConfig(
    long countCapacity,
    double countRefillPerSecond,
    long throughputCapacity,
    double throughputRefillPerSecond
) {
    public RateLimiterConfig {
        if (countCapacity <= 0) throw new IllegalArgumentException("countCapacity must be > 0");
        if (countRefillPerSecond <= 0) throw new IllegalArgumentException("countRefillPerSecond must be > 0");
        if (throughputCapacity <= 0) throw new IllegalArgumentException("throughputCapacity must be > 0");
        if (throughputRefillPerSecond <= 0) {
            throw new IllegalArgumentException("throughputRefillPerSecond must be > 0");
        }
    }

    /**
     * Per-minute budgets: each bucket holds one minute's worth and refills at capacity / 60 per second.
     *
     * @param maxRequestsPerMinute calls allowed per rolling minute
     * @param maxTokensPerMinute throughput units allowed per rolling minute
     * @return Configuration for both buckets
     */
    public static RateLimiterConfig perMinute(long maxRequestsPerMinute, long maxTokensPerMinute) {
        if (maxRequestsPerMinute <= 0) throw new IllegalArgumentException("maxRequestsPerMinute must be > 0");
        if (maxTokensPerMinute <= 0) throw new IllegalArgumentException("maxTokensPerMinute must be > 0");

        return new RateLimiterConfig(
            maxRequestsPerMinute,
            maxRequestsPerMinute / 60.0,
            maxTokensPerMinute,
            maxTokensPerMinute / 60.0
        );
    }
}
