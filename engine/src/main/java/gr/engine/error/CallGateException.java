package gr.engine.error;

/**
 * Base type of every classified failure surfaced by the gate.
 */
public abstract class CallGateException extends Exception {

    private final ErrorKind kind;

    protected CallGateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Short text suitable for an end user; never includes internal details.
     */
    public String userMessage() {
        return kind.userMessage();
    }
}
