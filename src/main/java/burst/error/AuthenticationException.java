package burst.error;

/**
 * SSH handshake or public-key authentication against an instance failed.
 */
public class AuthenticationException extends BurstException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
