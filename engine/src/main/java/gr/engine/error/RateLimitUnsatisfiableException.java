package gr.engine.error;

import gr.engine.limiter.Budget;

/**
 * A requested cost is larger than its bucket's capacity, so waiting cannot help.
 */
public final class RateLimitUnsatisfiableException extends CallGateException {

    private final Budget budget;
    private final long requestedCost;
    private final long capacity;

    public RateLimitUnsatisfiableException(Budget budget, long requestedCost, long capacity) {
        super(ErrorKind.RATE_LIMIT_UNSATISFIABLE,
            "Requested " + requestedCost + " " + budget.label() + "(s) exceeds " + budget.label()
                + " budget capacity " + capacity, null);
        this.budget = budget;
        this.requestedCost = requestedCost;
        this.capacity = capacity;
    }

    public Budget budget() {
        return budget;
    }

    public long requestedCost() {
        return requestedCost;
    }

    public long capacity() {
        return capacity;
    }
}
