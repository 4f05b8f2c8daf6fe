package gr.engine.retry;

import gr.engine.error.TransientOperationException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Caller-supplied decision on whether a failure is worth retrying.
 * The retry controller itself has no opinion.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Exception failure);

    /**
     * Retries every failure.
     */
    static FailureClassifier alwaysTransient() {
        return failure -> FailureKind.TRANSIENT;
    }

    /**
     * Failures assignable to one of {@code types} are transient, everything else is permanent.
     */
    @SafeVarargs
    static FailureClassifier transientOn(Class<? extends Exception>... types) {
        List<Class<? extends Exception>> transientTypes = List.of(types);
        return failure -> {
            for (Class<? extends Exception> type : transientTypes) {
                if (type.isInstance(failure)) {
                    return FailureKind.TRANSIENT;
                }
            }
            return FailureKind.PERMANENT;
        };
    }

    /**
     * I/O errors, timeouts and explicit {@link TransientOperationException}s are transient.
     */
    static FailureClassifier standard() {
        return transientOn(TransientOperationException.class, IOException.class, TimeoutException.class);
    }
}
