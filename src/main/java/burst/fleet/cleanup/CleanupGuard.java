package burst.fleet.cleanup;

import burst.cloud.api.ControlPlane;
import burst.cloud.api.ControlPlaneException;
import burst.cloud.creator.ProvisionedResources;
import burst.error.CleanupException;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Terminates every instance a run ever resolved, however the run ends.
 *
 * <p>The guard is armed with an empty id set and filled in place as instances resolve.
 * {@link #close()} hands termination to the {@link CleanupWorker} and returns immediately;
 * it acts only once, later calls are no-ops. Transient connectivity failures are retried
 * forever with capped exponential backoff; any other failure is logged and cleanup gives up.
 */
public final class CleanupGuard implements AutoCloseable {

    private static final String DEPENDENCY_VIOLATION = "DependencyViolation";
    private static final int GROUP_DELETE_ATTEMPTS = 60;

    private final ControlPlane controlPlane;
    private final CleanupWorker worker;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Logger log;

    private final Set<String> instanceIds = new LinkedHashSet<>();
    private final AtomicBoolean released = new AtomicBoolean();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private volatile ProvisionedResources resources;

    public CleanupGuard(ControlPlane controlPlane, CleanupWorker worker,
                        Duration initialBackoff, Duration maxBackoff, Logger log) {
        this.controlPlane = controlPlane;
        this.worker = worker;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.log = log;
        worker.arm(this);
    }

    /** Adds instance ids to terminate. Ids are never removed. */
    public void track(Collection<String> ids) {
        synchronized (instanceIds) {
            instanceIds.addAll(ids);
        }
    }

    public Set<String> trackedIds() {
        synchronized (instanceIds) {
            return Set.copyOf(instanceIds);
        }
    }

    /**
     * Also delete the run's security group and key pair after the instances are gone.
     * Without this the cloud-side group and key pair outlive the run.
     */
    public void teardownResources(ProvisionedResources resources) {
        this.resources = resources;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Completes once the background cleanup has finished (successfully or not). */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        worker.disarm(this);
        List<String> ids = List.copyOf(trackedIds());
        ProvisionedResources toDelete = resources;
        log.debug("terminating instances {}", ids);

        worker.submit(() -> {
            try {
                terminate(ids);
                if (toDelete != null) {
                    deleteResources(toDelete);
                }
            } finally {
                completion.complete(null);
            }
        });
    }

    private void terminate(List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        Backoff backoff = new Backoff(initialBackoff, maxBackoff);
        while (true) {
            try {
                controlPlane.terminateInstances(ids);
                log.debug("terminated {} instances", ids.size());
                return;
            } catch (ControlPlaneException e) {
                if (!e.isTransientConnectivity()) {
                    CleanupException failure = new CleanupException("failed to terminate instances " + ids, e);
                    log.warn("failed to terminate instances: {}", failure.getMessage(), e);
                    return;
                }
                log.trace("retrying instance termination");
                if (!pause(backoff)) {
                    log.warn("instance termination interrupted; {} may still be running", ids);
                    return;
                }
            }
        }
    }

    private void deleteResources(ProvisionedResources res) {
        log.debug("cleaning up temporary resources");
        try {
            controlPlane.deleteKeyPair(res.keyName());
            log.trace("deleted key pair {}", res.keyName());
        } catch (ControlPlaneException e) {
            log.warn("failed to clean key pair {}: {}", res.keyName(), e.getMessage());
        }

        // the group stays in use until every instance is fully terminated
        Backoff backoff = new Backoff(initialBackoff, maxBackoff);
        for (int attempt = 1; attempt <= GROUP_DELETE_ATTEMPTS; attempt++) {
            try {
                controlPlane.deleteSecurityGroup(res.securityGroupId());
                log.trace("deleted security group {}", res.securityGroupId());
                return;
            } catch (ControlPlaneException e) {
                boolean retry = e.isTransientConnectivity() || DEPENDENCY_VIOLATION.equals(e.errorCode());
                if (!retry || attempt == GROUP_DELETE_ATTEMPTS || !pause(backoff)) {
                    log.warn("failed to clean security group {}: {}", res.securityGroupId(), e.getMessage());
                    return;
                }
            }
        }
    }

    private static boolean pause(Backoff backoff) {
        try {
            Backoff.sleep(backoff.nextDelay());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
