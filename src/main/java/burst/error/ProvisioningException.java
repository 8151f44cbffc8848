package burst.error;

/**
 * Security group or key pair could not be created, or the private key could not be stored locally.
 */
public class ProvisioningException extends BurstException {

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
