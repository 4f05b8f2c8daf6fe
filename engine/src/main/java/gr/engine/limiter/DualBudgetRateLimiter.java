package gr.engine.limiter;

import gr.core.algorithms.token_bucket.TokenBucket;
import gr.core.clock.Clock;
import gr.core.clock.Sleeper;
import gr.core.model.ConsumeResult;
import gr.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe limiter charging every call against two token buckets at once.
 *
 * Features:
 * - COUNT bucket: one unit per call (requests per minute)
 * - THROUGHPUT bucket: caller-estimated size per call (tokens per minute)
 * - Joint consumption: a cost is deducted from both buckets or from neither
 * - Blocking acquisition bounded by an optional {@link Deadline}
 *
 * Thread-safety:
 * - One ReentrantLock guards both buckets; each attempt is a single short
 *   critical section (refill + probe both + commit both)
 * - The lock is released before suspending, so waiters never block each other
 *   or callers that would fit right now
 * - Waiters are not queued; ordering between them is best-effort
 *
 * Usage example:
 * <pre>
 * RateLimiterConfig config = RateLimiterConfig.perMinute(60, 90_000);
 * DualBudgetRateLimiter limiter = new DualBudgetRateLimiter(SystemClock.instance(), ThreadSleeper.instance(), config);
 *
 * AcquireResult result = limiter.acquire(1, estimatedTokens, Deadline.after(clock, Duration.ofSeconds(30)));
 * if (result.granted()) {
 *     // Issue the call
 * }
 * </pre>
 */
public final class DualBudgetRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(DualBudgetRateLimiter.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final RateLimiterConfig config;
    private final TokenBucket countBucket;
    private final TokenBucket throughputBucket;
    private final ReentrantLock lock = new ReentrantLock(); // Non-fair for better throughput

    /**
     * Creates a limiter with both buckets full.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param sleeper Suspension used while waiting for budget
     * @param config Bucket sizing
     * @throws IllegalArgumentException if any parameter is null
     */
    public DualBudgetRateLimiter(Clock clock, Sleeper sleeper, RateLimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.sleeper = sleeper;
        this.config = config;
        this.countBucket = new TokenBucket(clock, config.countCapacity(), config.countRefillPerSecond());
        this.throughputBucket = new TokenBucket(
            clock, config.throughputCapacity(), config.throughputRefillPerSecond());

        log.info("Rate limiter initialized: {} req/min, {} tokens/min",
            config.countCapacity(), config.throughputCapacity());
    }

    /**
     * Blocks until both costs can be taken together, the deadline passes, or
     * a cost turns out to exceed its bucket's capacity.
     *
     * Nothing is deducted unless the result is GRANTED.
     *
     * @param countCost units charged to the COUNT budget (normally 1)
     * @param throughputCost units charged to the THROUGHPUT budget
     * @param deadline bound on total blocking time
     * @return GRANTED, TIMED_OUT or UNSATISFIABLE
     * @throws InterruptedException if the thread is interrupted while waiting
     * @throws IllegalArgumentException if a cost is negative or deadline is null
     */
    public AcquireResult acquire(long countCost, long throughputCost, Deadline deadline)
        throws InterruptedException {
        validateCosts(countCost, throughputCost);
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }

        long waited = 0L;
        Budget lastBlocking = null;
        while (true) {
            Attempt attempt = attempt(countCost, throughputCost);

            if (attempt.decision() == Decision.ALLOW) {
                return AcquireResult.granted(lastBlocking, waited);
            }
            if (attempt.decision() == Decision.UNSATISFIABLE) {
                log.warn("Rate limit unsatisfiable: {} cost exceeds {} budget capacity {}",
                    costOf(attempt.budget(), countCost, throughputCost), attempt.budget().label(),
                    capacityOf(attempt.budget()));
                return AcquireResult.unsatisfiable(attempt.budget(), waited);
            }

            lastBlocking = attempt.budget();
            long remaining = deadline.remainingNanos(clock);
            if (remaining <= 0L) {
                log.warn("Rate limit wait timed out after {} seconds: {} budget exhausted",
                    seconds(waited), attempt.budget().label());
                return AcquireResult.timedOut(attempt.budget(), waited);
            }

            long sleepNanos = Math.min(attempt.waitNanos(), remaining);
            log.info("Waiting {} seconds: {} budget exhausted", seconds(sleepNanos), attempt.budget().label());
            sleeper.sleepNanos(sleepNanos);
            waited += sleepNanos;
        }
    }

    /**
     * Blocks without a deadline.
     */
    public AcquireResult acquire(long countCost, long throughputCost) throws InterruptedException {
        return acquire(countCost, throughputCost, Deadline.none());
    }

    /**
     * Single non-blocking attempt.
     *
     * @return GRANTED, REJECTED (with retry-after) or UNSATISFIABLE
     */
    public AcquireResult tryAcquire(long countCost, long throughputCost) {
        validateCosts(countCost, throughputCost);

        Attempt attempt = attempt(countCost, throughputCost);
        switch (attempt.decision()) {
            case ALLOW:
                return AcquireResult.granted(null, 0L);
            case UNSATISFIABLE:
                return AcquireResult.unsatisfiable(attempt.budget(), 0L);
            default:
                return AcquireResult.rejected(attempt.budget(), attempt.waitNanos());
        }
    }

    /**
     * Returns the tokens currently available in both budgets, after refill.
     */
    public BudgetSnapshot snapshot() {
        lock.lock();
        try {
            return new BudgetSnapshot(countBucket.availableTokens(), throughputBucket.availableTokens());
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterConfig config() {
        return config;
    }

    /**
     * One critical section: probe both buckets, commit both only if both allow.
     */
    private Attempt attempt(long countCost, long throughputCost) {
        lock.lock();
        try {
            ConsumeResult count = countBucket.probe(countCost);
            ConsumeResult throughput = throughputBucket.probe(throughputCost);

            if (count.decision() == Decision.UNSATISFIABLE) {
                return new Attempt(Decision.UNSATISFIABLE, Budget.COUNT, 0L);
            }
            if (throughput.decision() == Decision.UNSATISFIABLE) {
                return new Attempt(Decision.UNSATISFIABLE, Budget.THROUGHPUT, 0L);
            }

            if (count.allowed() && throughput.allowed()) {
                countBucket.commit(countCost);
                throughputBucket.commit(throughputCost);
                log.debug("Granted {} request(s), {} token(s)", countCost, throughputCost);
                return new Attempt(Decision.ALLOW, null, 0L);
            }

            if (count.retryAfterNanos() >= throughput.retryAfterNanos()) {
                return new Attempt(Decision.REJECT, Budget.COUNT, count.retryAfterNanos());
            }
            return new Attempt(Decision.REJECT, Budget.THROUGHPUT, throughput.retryAfterNanos());
        } finally {
            lock.unlock();
        }
    }

    private long capacityOf(Budget budget) {
        return budget == Budget.COUNT ? config.countCapacity() : config.throughputCapacity();
    }

    private static long costOf(Budget budget, long countCost, long throughputCost) {
        return budget == Budget.COUNT ? countCost : throughputCost;
    }

    private static void validateCosts(long countCost, long throughputCost) {
        if (countCost < 0) {
            throw new IllegalArgumentException("countCost must be >= 0, got: " + countCost);
        }
        if (throughputCost < 0) {
            throw new IllegalArgumentException("throughputCost must be >= 0, got: " + throughputCost);
        }
    }

    private static String seconds(long nanos) {
        return String.format(Locale.ROOT, "%.2f", nanos / 1_000_000_000.0);
    }

    private record Attempt(Decision decision, Budget budget, long waitNanos) {
    }
}
