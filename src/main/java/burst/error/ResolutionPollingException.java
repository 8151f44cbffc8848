package burst.error;

/**
 * Spot request polling failed, or some requests were rejected instead of fulfilled.
 */
public class ResolutionPollingException extends BurstException {

    public ResolutionPollingException(String message) {
        super(message);
    }

    public ResolutionPollingException(String message, Throwable cause) {
        super(message, cause);
    }
}
