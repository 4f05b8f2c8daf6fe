package gr.engine.error;

/**
 * Terminal outcomes a caller of the gate has to tell apart.
 */
public enum ErrorKind {
    RATE_LIMIT_UNSATISFIABLE(true, "Request is larger than the rate limit allows"),
    RATE_LIMIT_TIMED_OUT(true, "Rate limit reached, try again later"),
    PERMANENT_FAILURE(false, "Request failed and cannot be retried"),
    RETRIES_EXHAUSTED(false, "Request failed after several attempts");

    private final boolean rateLimit;
    private final String userMessage;

    ErrorKind(boolean rateLimit, String userMessage) {
        this.rateLimit = rateLimit;
        this.userMessage = userMessage;
    }

    /**
     * True for outcomes where the external operation was never invoked.
     */
    public boolean isRateLimit() {
        return rateLimit;
    }

    public String userMessage() {
        return userMessage;
    }
}
