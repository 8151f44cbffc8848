package burst.fleet.scheduler;

import burst.fleet.model.PendingRequest;

import java.util.List;
import java.util.Map;

/**
 * Outcome of spot request polling.
 *
 * @param instanceGroups fulfilled instance id to the group that requested it
 * @param rejected       requests that resolved without an instance
 */
public record Resolution(Map<String, String> instanceGroups, List<PendingRequest> rejected) {

    public Resolution {
        instanceGroups = Map.copyOf(instanceGroups);
        rejected = List.copyOf(rejected);
    }

    /** True when every request produced an instance. */
    public boolean fullyActive() {
        return rejected.isEmpty();
    }
}
