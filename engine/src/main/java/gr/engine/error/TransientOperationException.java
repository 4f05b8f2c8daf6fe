package gr.engine.error;

/**
 * Thrown by an operation to say "temporarily unavailable, try again".
 * {@link gr.engine.retry.FailureClassifier#standard()} treats it as transient.
 * It only reaches gate callers as the cause of a {@link RetriesExhaustedException}.
 */
public class TransientOperationException extends Exception {

    public TransientOperationException(String message) {
        super(message);
    }

    public TransientOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
