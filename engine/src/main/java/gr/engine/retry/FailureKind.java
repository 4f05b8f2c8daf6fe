package gr.engine.retry;

public enum FailureKind {
    /** Worth another attempt, e.g. service unavailable or a network timeout. */
    TRANSIENT,
    /** Retrying cannot help, e.g. malformed input. */
    PERMANENT
}
