package gr.engine.limiter;

/**
 * Outcome of a limiter acquisition.
 *
 * @param outcome what happened
 * @param blockingBudget the budget that denied or delayed the call; null when granted without waiting
 * @param waitedNanos total time spent suspended inside this acquisition
 * @param retryAfterNanos for {@link Outcome#REJECTED} only: time until the cost could fit
 */
public record AcquireResult(
    Outcome outcome,
    Budget blockingBudget,
    long waitedNanos,
    long retryAfterNanos
) {
    public enum Outcome {
        GRANTED,
        /** Non-blocking attempt found too few tokens. Only returned by tryAcquire. */
        REJECTED,
        TIMED_OUT,
        UNSATISFIABLE
    }

    public static AcquireResult granted(Budget lastBlocking, long waitedNanos) {
        return new AcquireResult(Outcome.GRANTED, lastBlocking, waitedNanos, 0L);
    }

    public static AcquireResult rejected(Budget budget, long retryAfterNanos) {
        return new AcquireResult(Outcome.REJECTED, budget, 0L, retryAfterNanos);
    }

    public static AcquireResult timedOut(Budget budget, long waitedNanos) {
        return new AcquireResult(Outcome.TIMED_OUT, budget, waitedNanos, 0L);
    }

    public static AcquireResult unsatisfiable(Budget budget, long waitedNanos) {
        return new AcquireResult(Outcome.UNSATISFIABLE, budget, waitedNanos, 0L);
    }

    public boolean granted() {
        return outcome == Outcome.GRANTED;
    }
}
