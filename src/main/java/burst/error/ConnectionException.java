package burst.error;

/**
 * TCP connection to an instance's SSH port could not be established.
 */
public class ConnectionException extends BurstException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
