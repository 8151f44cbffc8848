package burst.cloud.api;

/**
 * Failure reported by the control plane (or by the transport to it).
 */
public class ControlPlaneException extends RuntimeException {

    /** Error code EC2 returns while a freshly created spot request is not yet readable. */
    public static final String SPOT_REQUEST_NOT_FOUND = "InvalidSpotInstanceRequestID.NotFound";

    private final String errorCode;
    private final boolean transientConnectivity;

    public ControlPlaneException(String message, String errorCode, boolean transientConnectivity, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.transientConnectivity = transientConnectivity;
    }

    public ControlPlaneException(String message, String errorCode) {
        this(message, errorCode, false, null);
    }

    public static ControlPlaneException connectivity(String message, Throwable cause) {
        return new ControlPlaneException(message, null, true, cause);
    }

    public String errorCode() {
        return errorCode;
    }

    /** Connection reset, broken pipe and similar transport drops. Safe to retry idempotent calls. */
    public boolean isTransientConnectivity() {
        return transientConnectivity;
    }

    /** Read-after-write lag: the spot request exists but describe does not see it yet. */
    public boolean isRequestNotYetVisible() {
        if (SPOT_REQUEST_NOT_FOUND.equals(errorCode)) {
            return true;
        }
        String msg = getMessage();
        return msg != null
                && msg.contains("The spot instance request ID")
                && msg.contains("does not exist");
    }
}
