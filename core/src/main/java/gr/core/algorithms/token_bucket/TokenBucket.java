package gr.core.algorithms.token_bucket;

import gr.core.clock.Clock;
import gr.core.model.ConsumeResult;

/**
 * Token Bucket:
 * - capacity: max tokens, also the starting balance
 * - refillTokensPerSecond: continuous refill, clamped to capacity
 *
 * Evaluation and deduction are split ({@link #probe} / {@link #commit}) so an
 * owner can check several buckets before touching any of them.
 *
 * Thread-safety: none. The owner serializes every call.
 */
public final class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Clock clock;
    private final long capacity;
    private final double refillTokensPerSecond;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, long capacity, double refillTokensPerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillTokensPerSecond <= 0) throw new IllegalArgumentException("refill <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillTokensPerSecond = refillTokensPerSecond;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    /**
     * Refills, then reports whether {@code cost} could be taken now. Deducts nothing.
     */
    public ConsumeResult probe(long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost < 0");
        refill();

        if (cost > capacity) {
            return ConsumeResult.unsatisfiable(cost - tokens);
        }
        if (tokens >= cost) {
            return ConsumeResult.allow();
        }

        double missing = cost - tokens;
        long retryAfter = (long) Math.ceil(missing * NANOS_PER_SECOND / refillTokensPerSecond);
        return ConsumeResult.reject(missing, retryAfter);
    }

    /**
     * Deducts a cost that the last {@link #probe} allowed.
     * No refill happens in between, so the balance cannot have dropped.
     */
    public void commit(long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost < 0");
        if (cost > tokens) {
            throw new IllegalStateException("commit of " + cost + " exceeds available " + tokens);
        }
        tokens -= cost;
    }

    public ConsumeResult tryConsume(long cost) {
        ConsumeResult result = probe(cost);
        if (result.allowed()) {
            commit(cost);
        }
        return result;
    }

    public double availableTokens() {
        refill();
        return tokens;
    }

    public long capacity() {
        return capacity;
    }

    public double refillTokensPerSecond() {
        return refillTokensPerSecond;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillTokensPerSecond / NANOS_PER_SECOND);
        lastNanos = now;
    }
}
