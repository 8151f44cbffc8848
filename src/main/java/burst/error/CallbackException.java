package burst.error;

/**
 * The caller's fleet callback failed.
 */
public class CallbackException extends BurstException {

    public CallbackException(String message) {
        super(message);
    }

    public CallbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
