package burst.error;

/**
 * Base type for every failure surfaced by a fleet run.
 * Subclasses identify the phase that failed.
 */
public class BurstException extends RuntimeException {

    public BurstException(String message) {
        super(message);
    }

    public BurstException(String message, Throwable cause) {
        super(message, cause);
    }
}
