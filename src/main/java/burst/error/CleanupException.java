package burst.error;

/**
 * Instance termination or resource teardown failed. Logged, never thrown out of a run.
 */
public class CleanupException extends BurstException {

    public CleanupException(String message) {
        super(message);
    }

    public CleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
