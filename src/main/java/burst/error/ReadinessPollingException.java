package burst.error;

/**
 * Describing the fulfilled instances failed.
 */
public class ReadinessPollingException extends BurstException {

    public ReadinessPollingException(String message) {
        super(message);
    }

    public ReadinessPollingException(String message, Throwable cause) {
        super(message, cause);
    }
}
