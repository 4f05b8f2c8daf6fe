package gr.engine.error;

import gr.engine.retry.AttemptRecord;

import java.util.List;

/**
 * The operation failed in a way classified as not worth retrying.
 * The original failure is the cause.
 */
public final class PermanentOperationException extends CallGateException {

    private final List<AttemptRecord> attempts;

    public PermanentOperationException(Throwable cause, List<AttemptRecord> attempts) {
        super(ErrorKind.PERMANENT_FAILURE,
            "Permanent failure on attempt " + attempts.size() + ": " + cause, cause);
        this.attempts = List.copyOf(attempts);
    }

    public List<AttemptRecord> attempts() {
        return attempts;
    }
}
