package burst.fleet.model;

/**
 * Resolution state of a spot request.
 */
public enum RequestState {
    /** Waiting for capacity */
    OPEN,
    /** Fulfilled; may still lack an instance id for a short while */
    ACTIVE,
    /** Closed, cancelled, failed or otherwise not going to produce an instance */
    REJECTED;

    public static RequestState fromProvider(String state) {
        if (state == null) {
            return OPEN;
        }
        return switch (state) {
            case "open" -> OPEN;
            case "active" -> ACTIVE;
            default -> REJECTED;
        };
    }
}
