package gr.engine.cost;

/**
 * Turns a request payload into the throughput cost charged to the token budget.
 * Estimates are computed before the call; under-estimating is tolerated.
 */
@FunctionalInterface
public interface CostEstimator {

    /**
     * @return estimated cost, 0 for null or empty payloads
     */
    long estimate(String payload);
}
