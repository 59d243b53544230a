package domain.error;

/**
 * Base class for failures that end an invocation.
 *
 * <p>Each subtype maps to one process exit code, so the CLI can translate any failure
 * in one place.</p>
 */
public abstract class XplanException extends RuntimeException {

    protected XplanException(String message) {
        super(message);
    }

    protected XplanException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int exitCode();
}
