package burst.error;

/**
 * A spot request for a machine group was refused by the control plane.
 */
public class RequestSubmissionException extends BurstException {

    public RequestSubmissionException(String message) {
        super(message);
    }

    public RequestSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
