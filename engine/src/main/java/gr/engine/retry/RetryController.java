package gr.engine.retry;

import gr.core.clock.Sleeper;
import gr.engine.error.PermanentOperationException;
import gr.engine.error.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Runs an operation with bounded exponential-backoff retries.
 *
 * <p>Each failure goes through the caller's {@link FailureClassifier}:
 * <ul>
 *   <li>PERMANENT: fail at once with {@link PermanentOperationException}, no wait</li>
 *   <li>TRANSIENT with attempts left: sleep {@link RetryPolicy#backoffAfter(int)}, try again</li>
 *   <li>TRANSIENT on the last attempt: {@link RetriesExhaustedException} with the full history</li>
 * </ul>
 *
 * <p>Thread-safety: holds no per-call state, one instance can serve any number of threads.
 * Interrupting the calling thread stops new attempts; an operation already running is
 * responsible for its own cancellation.
 */
public final class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final Sleeper sleeper;

    public RetryController(Sleeper sleeper) {
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code operation} until it succeeds, fails permanently or runs out of attempts.
     *
     * @return the operation's result
     * @throws PermanentOperationException on the first failure classified as permanent
     * @throws RetriesExhaustedException when {@code policy.maxAttempts()} transient failures occurred
     * @throws InterruptedException if the thread is interrupted between attempts
     */
    public <T> T execute(Callable<T> operation, RetryPolicy policy, FailureClassifier classifier)
        throws PermanentOperationException, RetriesExhaustedException, InterruptedException {
        return executeRecorded(operation, policy, classifier).value();
    }

    /**
     * Same as {@link #execute} but also returns the attempts made on the way to success.
     */
    public <T> RetryResult<T> executeRecorded(Callable<T> operation, RetryPolicy policy, FailureClassifier classifier)
        throws PermanentOperationException, RetriesExhaustedException, InterruptedException {
        if (operation == null) throw new IllegalArgumentException("operation cannot be null");
        if (policy == null) throw new IllegalArgumentException("policy cannot be null");
        if (classifier == null) throw new IllegalArgumentException("classifier cannot be null");

        List<AttemptRecord> attempts = new ArrayList<>(policy.maxAttempts());
        Duration wait = Duration.ZERO;

        for (int attempt = 1; ; attempt++) {
            if (attempt > 1) {
                sleeper.sleepNanos(wait.toNanos());
            } else if (Thread.interrupted()) {
                throw new InterruptedException("interrupted before first attempt");
            }

            Exception failure;
            try {
                T value = operation.call();
                attempts.add(AttemptRecord.success(attempt, wait));
                if (attempt > 1) {
                    log.info("Call succeeded on attempt {}/{}", attempt, policy.maxAttempts());
                }
                return new RetryResult<>(value, attempts);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                failure = e;
            }

            FailureKind kind = classifier.classify(failure);
            if (kind != FailureKind.TRANSIENT) {
                attempts.add(AttemptRecord.failed(attempt, wait, FailureKind.PERMANENT, failure));
                log.error("Attempt {}/{} failed permanently, not retrying: {}",
                    attempt, policy.maxAttempts(), AttemptRecord.describe(failure));
                throw new PermanentOperationException(failure, attempts);
            }

            attempts.add(AttemptRecord.failed(attempt, wait, FailureKind.TRANSIENT, failure));
            if (attempt >= policy.maxAttempts()) {
                log.error("Call failed after {} attempts: {}; history={}",
                    attempt, AttemptRecord.describe(failure), attempts);
                throw new RetriesExhaustedException(failure, attempts);
            }

            wait = policy.backoffAfter(attempt);
            log.warn("Attempt {}/{} failed ({}), retrying in {} seconds",
                attempt, policy.maxAttempts(), AttemptRecord.describe(failure), seconds(wait));
        }
    }

    private static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000_000.0);
    }
}
