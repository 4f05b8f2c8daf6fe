package gr.core.model;

/**
 * Outcome of evaluating a cost against a single bucket.
 *
 * @param decision ALLOW, REJECT or UNSATISFIABLE
 * @param deficit tokens missing at evaluation time (0 when allowed)
 * @param retryAfterNanos time until this exact cost could be satisfied, ignoring
 *                        other consumers (0 unless REJECT)
 */
public record ConsumeResult(
    Decision decision,
    double deficit,
    long retryAfterNanos
) {
    public static ConsumeResult allow() {
        return new ConsumeResult(Decision.ALLOW, 0d, 0L);
    }

    public static ConsumeResult reject(double deficit, long retryAfterNanos) {
        return new ConsumeResult(Decision.REJECT, deficit, Math.max(1L, retryAfterNanos));
    }

    public static ConsumeResult unsatisfiable(double deficit) {
        return new ConsumeResult(Decision.UNSATISFIABLE, deficit, 0L);
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
