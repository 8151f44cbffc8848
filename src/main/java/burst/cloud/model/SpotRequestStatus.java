package burst.cloud.model;

/**
 * One row of "describe spot instance requests".
 *
 * @param requestId  spot request id
 * @param state      raw provider state (open, active, closed, cancelled, failed)
 * @param instanceId assigned instance, null until the request is fulfilled
 */
public record SpotRequestStatus(String requestId, String state, String instanceId) {
}
