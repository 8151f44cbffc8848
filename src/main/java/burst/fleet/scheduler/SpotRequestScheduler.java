package burst.fleet.scheduler;

import burst.cloud.api.ControlPlane;
import burst.cloud.api.ControlPlaneException;
import burst.cloud.creator.ProvisionedResources;
import burst.cloud.model.LaunchSpec;
import burst.cloud.model.SpotRequestStatus;
import burst.error.RequestSubmissionException;
import burst.error.ResolutionPollingException;
import burst.fleet.model.FleetPlan;
import burst.fleet.model.MachineSetup;
import burst.fleet.model.PendingRequest;
import burst.fleet.model.RequestState;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Drives the spot request lifecycle for one run:
 * submit one request per group, poll until every request is resolved,
 * then cancel the requests (never the instances) so nothing is re-issued later.
 *
 * Fulfilled instance ids are handed to the {@code fulfilled} sink as soon as they are
 * known, before cancellation, so the cleanup guard covers them even if a later step throws.
 */
public class SpotRequestScheduler {

    private static final int CANCEL_ATTEMPTS = 3;

    private final ControlPlane controlPlane;
    private final Duration pollInterval;
    private final Logger log;

    public SpotRequestScheduler(ControlPlane controlPlane, Duration pollInterval, Logger log) {
        this.controlPlane = controlPlane;
        this.pollInterval = pollInterval;
        this.log = log;
    }

    public Resolution schedule(FleetPlan plan, ProvisionedResources resources,
                               Consumer<Collection<String>> fulfilled) {
        Map<String, PendingRequest> requests = submit(plan, resources, fulfilled);
        try {
            return awaitResolution(requests, fulfilled);
        } catch (RuntimeException e) {
            handOverLaunched(requests.keySet(), fulfilled);
            throw e;
        } finally {
            cancel(requests.keySet());
        }
    }

    /**
     * Submits one spot request per group.
     *
     * @return submitted requests keyed by request id
     */
    Map<String, PendingRequest> submit(FleetPlan plan, ProvisionedResources resources,
                                       Consumer<Collection<String>> fulfilled) {
        Map<String, PendingRequest> requests = new LinkedHashMap<>();
        log.debug("issuing spot requests");

        for (Map.Entry<String, FleetPlan.Group> entry : plan.groups().entrySet()) {
            String name = entry.getKey();
            MachineSetup setup = entry.getValue().setup();
            int count = entry.getValue().count();

            LaunchSpec spec = new LaunchSpec(setup.imageId(), setup.instanceType(),
                    resources.securityGroupId(), resources.keyName());

            List<String> ids;
            try {
                ids = controlPlane.requestSpotInstances(spec, count);
            } catch (ControlPlaneException e) {
                abandon(requests, fulfilled);
                throw new RequestSubmissionException("failed to request spot instances for " + name, e);
            }

            log.trace("issued spot request for {} (#{})", name, count);
            for (String id : ids) {
                log.trace("activated spot request {}", id);
                requests.put(id, PendingRequest.submitted(id, name));
            }
        }
        return requests;
    }

    /**
     * Polls until no request is pending. A request id that is not yet visible counts as pending.
     * Each instance id is handed to {@code fulfilled} in the round its request is fulfilled.
     */
    Resolution awaitResolution(Map<String, PendingRequest> submitted, Consumer<Collection<String>> fulfilled) {
        Map<String, PendingRequest> current = new LinkedHashMap<>(submitted);
        log.debug("waiting for instances to spawn");

        while (true) {
            log.trace("checking spot request status");
            List<SpotRequestStatus> statuses;
            try {
                statuses = controlPlane.describeSpotRequests(current.keySet());
            } catch (ControlPlaneException e) {
                if (e.isRequestNotYetVisible()) {
                    log.trace("spot instance request not yet ready");
                    pause();
                    continue;
                }
                throw new ResolutionPollingException("failed to describe spot instance requests", e);
            }

            List<String> newlyFulfilled = new ArrayList<>();
            for (SpotRequestStatus status : statuses) {
                PendingRequest known = current.get(status.requestId());
                if (known == null) {
                    continue;
                }
                PendingRequest updated = known.withStatus(RequestState.fromProvider(status.state()), status.instanceId());
                if (updated.isFulfilled() && !known.isFulfilled()) {
                    newlyFulfilled.add(updated.instanceId());
                }
                current.put(status.requestId(), updated);
            }
            if (!newlyFulfilled.isEmpty()) {
                fulfilled.accept(newlyFulfilled);
            }

            boolean anyPending = false;
            for (PendingRequest request : current.values()) {
                if (request.isPending()) {
                    anyPending = true;
                } else {
                    log.trace("spot request {} resolved as {}", request.requestId(), request.state());
                }
            }

            if (!anyPending) {
                return partition(current.values());
            }
            pause();
        }
    }

    private Resolution partition(Collection<PendingRequest> resolved) {
        Map<String, String> instanceGroups = new LinkedHashMap<>();
        List<PendingRequest> rejected = new ArrayList<>();
        for (PendingRequest request : resolved) {
            if (request.isFulfilled()) {
                log.trace("spot request satisfied: setup={} iid={}", request.group(), request.instanceId());
                instanceGroups.put(request.instanceId(), request.group());
            } else {
                rejected.add(request);
            }
        }
        return new Resolution(instanceGroups, rejected);
    }

    /**
     * Cancels the requests so they are never fulfilled again. Failure is only logged:
     * fulfilled requests are already consumed by their instances.
     */
    void cancel(Collection<String> requestIds) {
        if (requestIds.isEmpty()) {
            return;
        }
        log.trace("terminating spot requests");
        List<String> ids = List.copyOf(requestIds);
        for (int attempt = 1; ; attempt++) {
            try {
                controlPlane.cancelSpotRequests(ids);
                return;
            } catch (ControlPlaneException e) {
                if (e.isTransientConnectivity() && attempt < CANCEL_ATTEMPTS) {
                    log.trace("retrying spot request cancellation");
                    continue;
                }
                log.warn("failed to cancel spot instance requests: {}", e.getMessage());
                return;
            }
        }
    }

    // Submission failed part-way: stop earlier requests and hand over whatever they already launched.
    private void abandon(Map<String, PendingRequest> submitted, Consumer<Collection<String>> fulfilled) {
        if (submitted.isEmpty()) {
            return;
        }
        cancel(submitted.keySet());
        handOverLaunched(submitted.keySet(), fulfilled);
    }

    // One last look at the requests so instances launched since the previous round are still terminated.
    private void handOverLaunched(Collection<String> requestIds, Consumer<Collection<String>> fulfilled) {
        try {
            List<String> launched = new ArrayList<>();
            for (SpotRequestStatus status : controlPlane.describeSpotRequests(requestIds)) {
                if (status.instanceId() != null) {
                    launched.add(status.instanceId());
                }
            }
            if (!launched.isEmpty()) {
                fulfilled.accept(launched);
            }
        } catch (ControlPlaneException e) {
            log.warn("could not look up instances of abandoned spot requests: {}", e.getMessage());
        }
    }

    private void pause() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ResolutionPollingException("interrupted while waiting for spot requests");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionPollingException("interrupted while waiting for spot requests", e);
        }
    }
}
