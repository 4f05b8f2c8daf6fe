package gr.engine.limiter;

/**
 * The two budgets a call is charged against.
 */
public enum Budget {
    /** One unit per call. */
    COUNT("request"),
    /** Caller-estimated work size, e.g. prompt tokens. */
    THROUGHPUT("token");

    private final String label;

    Budget(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
