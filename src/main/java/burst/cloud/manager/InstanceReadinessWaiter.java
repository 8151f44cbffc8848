package burst.cloud.manager;

import burst.cloud.api.ControlPlane;
import burst.cloud.api.ControlPlaneException;
import burst.cloud.model.InstanceDescription;
import burst.error.ReadinessPollingException;
import burst.fleet.model.FleetInstance;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls "describe instances" until every fulfilled instance reports full addressing.
 * Each round rebuilds the fleet from scratch; a single incomplete instance fails the round.
 * There is no timeout: callers bound the whole run externally.
 */
public class InstanceReadinessWaiter {

    private final ControlPlane controlPlane;
    private final Duration pollInterval;
    private final Logger log;

    public InstanceReadinessWaiter(ControlPlane controlPlane, Duration pollInterval, Logger log) {
        this.controlPlane = controlPlane;
        this.pollInterval = pollInterval;
        this.log = log;
    }

    /**
     * @param instanceGroups instance id to owning group name
     * @return ready instances grouped by group name, in the order the ids were given
     */
    public Map<String, List<FleetInstance>> awaitReady(Map<String, String> instanceGroups) {
        if (instanceGroups.isEmpty()) {
            return Map.of();
        }
        List<String> ids = new ArrayList<>(instanceGroups.keySet());

        while (true) {
            Map<String, FleetInstance> ready = pollOnce(ids, instanceGroups);
            if (ready != null) {
                Map<String, List<FleetInstance>> machines = new LinkedHashMap<>();
                for (String id : ids) {
                    FleetInstance machine = ready.get(id);
                    machines.computeIfAbsent(machine.group(), g -> new ArrayList<>()).add(machine);
                }
                return machines;
            }
            pause();
        }
    }

    // null when at least one instance is still missing addressing
    private Map<String, FleetInstance> pollOnce(List<String> ids, Map<String, String> instanceGroups) {
        List<InstanceDescription> described;
        try {
            described = controlPlane.describeInstances(ids);
        } catch (ControlPlaneException e) {
            throw new ReadinessPollingException("failed to describe instances " + ids, e);
        }

        Map<String, FleetInstance> ready = new HashMap<>();
        boolean allReady = true;
        for (InstanceDescription d : described) {
            String group = d.instanceId() == null ? null : instanceGroups.get(d.instanceId());
            if (group == null) {
                continue;
            }
            if (d.isFullyAddressed()) {
                FleetInstance machine = FleetInstance.from(d, group);
                log.trace("instance ready: set={} ip={}", group, machine.publicIp());
                ready.put(d.instanceId(), machine);
            } else {
                allReady = false;
            }
        }

        if (!allReady || ready.size() < ids.size()) {
            return null;
        }
        return ready;
    }

    private void pause() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ReadinessPollingException("interrupted while waiting for instances");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadinessPollingException("interrupted while waiting for instances", e);
        }
    }
}
