package gr.engine.error;

import gr.engine.retry.AttemptRecord;

import java.util.List;

/**
 * Every allowed attempt failed transiently. The last failure is the cause.
 */
public final class RetriesExhaustedException extends CallGateException {

    private final List<AttemptRecord> attempts;

    public RetriesExhaustedException(Throwable lastError, List<AttemptRecord> attempts) {
        super(ErrorKind.RETRIES_EXHAUSTED,
            "Failed after " + attempts.size() + " attempts, last error: " + lastError, lastError);
        this.attempts = List.copyOf(attempts);
    }

    public Throwable lastError() {
        return getCause();
    }

    public List<AttemptRecord> attempts() {
        return attempts;
    }

    public int attemptCount() {
        return attempts.size();
    }

    @Override
    public String userMessage() {
        return "Request failed after " + attempts.size() + " attempts";
    }
}
