package gr.engine.error;

import gr.engine.limiter.Budget;

import java.time.Duration;

/**
 * The deadline passed before both budgets had room for the call.
 */
public final class RateLimitTimedOutException extends CallGateException {

    private final Budget budget;
    private final Duration waited;

    public RateLimitTimedOutException(Budget budget, Duration waited) {
        super(ErrorKind.RATE_LIMIT_TIMED_OUT,
            "Timed out after " + waited.toMillis() + "ms waiting for " + budget.label() + " budget", null);
        this.budget = budget;
        this.waited = waited;
    }

    public Budget budget() {
        return budget;
    }

    public Duration waited() {
        return waited;
    }
}
