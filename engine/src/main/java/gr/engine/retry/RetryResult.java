package gr.engine.retry;

import java.util.List;

/**
 * Successful value together with every attempt it took.
 */
public record RetryResult<T>(T value, List<AttemptRecord> attempts) {
    public RetryResult {
        attempts = List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }
}
