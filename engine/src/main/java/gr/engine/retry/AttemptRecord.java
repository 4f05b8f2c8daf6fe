package gr.engine.retry;

import java.time.Duration;

/**
 * One attempt made by {@link RetryController}, kept for diagnostics.
 *
 * @param attemptNumber 1-based
 * @param waitBeforeAttempt backoff slept before this attempt (zero for the first)
 * @param outcome how the attempt ended
 * @param failure short description of the error; null on success
 */
public record AttemptRecord(
    int attemptNumber,
    Duration waitBeforeAttempt,
    AttemptOutcome outcome,
    String failure
) {
    public enum AttemptOutcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    static AttemptRecord success(int attemptNumber, Duration wait) {
        return new AttemptRecord(attemptNumber, wait, AttemptOutcome.SUCCESS, null);
    }

    static AttemptRecord failed(int attemptNumber, Duration wait, FailureKind kind, Exception error) {
        AttemptOutcome outcome = kind == FailureKind.TRANSIENT
            ? AttemptOutcome.TRANSIENT_FAILURE
            : AttemptOutcome.PERMANENT_FAILURE;
        return new AttemptRecord(attemptNumber, wait, outcome, describe(error));
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public String toString() {
        return "#" + attemptNumber + " after " + waitBeforeAttempt.toMillis() + "ms -> " + outcome
            + (failure == null ? "" : " (" + failure + ")");
    }
}
