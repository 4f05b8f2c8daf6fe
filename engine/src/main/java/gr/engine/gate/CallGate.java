package gr.engine.gate;

import gr.core.clock.Clock;
import gr.core.clock.Sleeper;
import gr.core.clock.SystemClock;
import gr.core.clock.ThreadSleeper;
import gr.engine.config.GateSettings;
import gr.engine.error.CallGateException;
import gr.engine.error.RateLimitTimedOutException;
import gr.engine.error.RateLimitUnsatisfiableException;
import gr.engine.limiter.AcquireResult;
import gr.engine.limiter.Budget;
import gr.engine.limiter.Deadline;
import gr.engine.limiter.DualBudgetRateLimiter;
import gr.engine.retry.FailureClassifier;
import gr.engine.retry.RetryController;
import gr.engine.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Entry point for outbound calls: limit first, then retry.
 *
 * <p>Order of operations for every call:
 * <ol>
 *   <li>Acquire both budgets from the {@link DualBudgetRateLimiter} (skipped when rate limiting
 *       is disabled). TIMED_OUT and UNSATISFIABLE become
 *       {@link RateLimitTimedOutException} / {@link RateLimitUnsatisfiableException} and the
 *       operation is never invoked. Budget exhaustion is not retried.</li>
 *   <li>Run the operation through the {@link RetryController} and return its outcome as is.</li>
 * </ol>
 *
 * <p>Budget is charged once per {@code invoke}, not once per retry attempt.
 *
 * <p>Thread-safety: safe for concurrent use; the limiter is the only shared state.
 */
public final class CallGate {

    private static final Logger log = LoggerFactory.getLogger(CallGate.class);

    private final DualBudgetRateLimiter limiter;
    private final boolean rateLimitingEnabled;
    private final RetryController retryController;
    private final RetryPolicy defaultPolicy;
    private final FailureClassifier defaultClassifier;

    /**
     * @param limiter Limiter shared by every call through this gate
     * @param rateLimitingEnabled When false every call is granted without touching the limiter
     * @param retryController Retry loop
     * @param defaultPolicy Policy used by the overloads that take none
     * @param defaultClassifier Classifier used by the overloads that take none
     */
    public CallGate(
        DualBudgetRateLimiter limiter,
        boolean rateLimitingEnabled,
        RetryController retryController,
        RetryPolicy defaultPolicy,
        FailureClassifier defaultClassifier
    ) {
        if (limiter == null) throw new IllegalArgumentException("limiter cannot be null");
        if (retryController == null) throw new IllegalArgumentException("retryController cannot be null");
        if (defaultPolicy == null) throw new IllegalArgumentException("defaultPolicy cannot be null");
        if (defaultClassifier == null) throw new IllegalArgumentException("defaultClassifier cannot be null");

        this.limiter = limiter;
        this.rateLimitingEnabled = rateLimitingEnabled;
        this.retryController = retryController;
        this.defaultPolicy = defaultPolicy;
        this.defaultClassifier = defaultClassifier;

        log.info("Call gate ready: rate limiting {}, retry policy {}",
            rateLimitingEnabled ? "enabled" : "disabled", defaultPolicy);
    }

    /**
     * Production gate: system clock, blocking sleeps, standard failure classification.
     */
    public static CallGate create(GateSettings settings) {
        return create(settings, SystemClock.instance(), ThreadSleeper.instance(), FailureClassifier.standard());
    }

    public static CallGate create(GateSettings settings, Clock clock, Sleeper sleeper, FailureClassifier classifier) {
        if (settings == null) throw new IllegalArgumentException("settings cannot be null");
        return new CallGate(
            new DualBudgetRateLimiter(clock, sleeper, settings.toRateLimiterConfig()),
            settings.rateLimitingEnabled(),
            new RetryController(sleeper),
            settings.toRetryPolicy(),
            classifier
        );
    }

    /**
     * Acquires budget, then runs {@code operation} with retries.
     *
     * @param operation The external request
     * @param countCost Units charged to the request budget (normally 1)
     * @param throughputCost Estimated size of the request, charged to the token budget
     * @param deadline Bound on time spent waiting for budget
     * @param policy Retry policy for this call
     * @param classifier Transient/permanent decision for this call's failures
     * @return The operation's result
     * @throws RateLimitUnsatisfiableException if a cost exceeds its budget's capacity
     * @throws RateLimitTimedOutException if the deadline passed while waiting for budget
     * @throws gr.engine.error.PermanentOperationException on a permanent failure
     * @throws gr.engine.error.RetriesExhaustedException when every attempt failed transiently
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public <T> T invoke(
        Callable<T> operation,
        long countCost,
        long throughputCost,
        Deadline deadline,
        RetryPolicy policy,
        FailureClassifier classifier
    ) throws CallGateException, InterruptedException {
        if (operation == null) throw new IllegalArgumentException("operation cannot be null");
        // checked here too so a disabled gate rejects the same arguments
        if (countCost < 0) {
            throw new IllegalArgumentException("countCost must be >= 0, got: " + countCost);
        }
        if (throughputCost < 0) {
            throw new IllegalArgumentException("throughputCost must be >= 0, got: " + throughputCost);
        }
        if (deadline == null) throw new IllegalArgumentException("deadline cannot be null");

        if (rateLimitingEnabled) {
            AcquireResult result = limiter.acquire(countCost, throughputCost, deadline);
            switch (result.outcome()) {
                case GRANTED:
                    break;
                case UNSATISFIABLE:
                    throw unsatisfiable(result.blockingBudget(), countCost, throughputCost);
                case TIMED_OUT:
                    throw new RateLimitTimedOutException(
                        result.blockingBudget(), Duration.ofNanos(result.waitedNanos()));
                default:
                    throw new IllegalStateException("Unexpected acquire outcome: " + result.outcome());
            }
        }

        return retryController.execute(operation, policy, classifier);
    }

    public <T> T invoke(Callable<T> operation, long throughputCost, Deadline deadline)
        throws CallGateException, InterruptedException {
        return invoke(operation, 1L, throughputCost, deadline, defaultPolicy, defaultClassifier);
    }

    public <T> T invoke(Callable<T> operation, long throughputCost) throws CallGateException, InterruptedException {
        return invoke(operation, throughputCost, Deadline.none());
    }

    /**
     * Like {@link #invoke(Callable, long)} but any classified gate error is logged and
     * replaced by {@code fallback}. Interruption still propagates.
     */
    public <T> T invokeOrDefault(Callable<T> operation, long throughputCost, T fallback) throws InterruptedException {
        try {
            return invoke(operation, throughputCost);
        } catch (CallGateException e) {
            log.error("Call failed ({}), returning fallback value: {}", e.kind(), e.getMessage(), e);
            return fallback;
        }
    }

    public boolean rateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public DualBudgetRateLimiter limiter() {
        return limiter;
    }

    public RetryPolicy defaultPolicy() {
        return defaultPolicy;
    }

    private RateLimitUnsatisfiableException unsatisfiable(Budget budget, long countCost, long throughputCost) {
        if (budget == Budget.COUNT) {
            return new RateLimitUnsatisfiableException(budget, countCost, limiter.config().countCapacity());
        }
        return new RateLimitUnsatisfiableException(budget, throughputCost, limiter.config().throughputCapacity());
    }
}
