package burst.fleet.model;

import java.util.Objects;

/**
 * A submitted spot request, bound to the group that asked for it.
 */
public record PendingRequest(String requestId, String group, RequestState state, String instanceId) {

    public PendingRequest {
        Objects.requireNonNull(requestId, "requestId is required");
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(state, "state is required");
    }

    public static PendingRequest submitted(String requestId, String group) {
        return new PendingRequest(requestId, group, RequestState.OPEN, null);
    }

    /** Still waiting: open, or active but the instance id has not been assigned yet. */
    public boolean isPending() {
        return state == RequestState.OPEN || (state == RequestState.ACTIVE && instanceId == null);
    }

    public boolean isFulfilled() {
        return state == RequestState.ACTIVE && instanceId != null;
    }

    public PendingRequest withStatus(RequestState state, String instanceId) {
        return new PendingRequest(requestId, group, state, instanceId);
    }
}
