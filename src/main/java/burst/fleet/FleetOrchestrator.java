package burst.fleet;

import burst.cloud.api.ControlPlane;
import burst.cloud.config.BurstConfig;
import burst.cloud.creator.ProvisionedResources;
import burst.cloud.creator.ResourceProvisioner;
import burst.cloud.manager.InstanceReadinessWaiter;
import burst.error.BurstException;
import burst.error.CallbackException;
import burst.error.ResolutionPollingException;
import burst.fleet.cleanup.CleanupGuard;
import burst.fleet.cleanup.CleanupWorker;
import burst.fleet.model.FleetCallback;
import burst.fleet.model.FleetInstance;
import burst.fleet.model.FleetPlan;
import burst.fleet.model.PendingRequest;
import burst.fleet.model.SetupRoutine;
import burst.fleet.scheduler.Resolution;
import burst.fleet.scheduler.SpotRequestScheduler;
import burst.fleet.setup.ParallelSetupExecutor;
import burst.fleet.setup.SessionOpener;
import burst.fleet.setup.SetupReport;
import burst.ssh.RemoteSession;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sequences one fleet run:
 * provisioning, spot request submission, resolution polling, request cancellation,
 * readiness polling, parallel setup and finally the caller's callback.
 *
 * The cleanup guard is armed right after provisioning and released on every exit path,
 * so each instance that ever resolved is terminated no matter where the run stopped.
 */
public class FleetOrchestrator {

    private final FleetPlan plan;
    private final ControlPlane controlPlane;
    private final BurstConfig config;
    private final CleanupWorker cleanupWorker;
    private final Function<Path, SessionOpener> openers;
    private final Duration maxDuration;
    private final Logger log;
    private final CompletableFuture<Void> cleanupDone = new CompletableFuture<>();

    public FleetOrchestrator(FleetPlan plan,
                             ControlPlane controlPlane,
                             BurstConfig config,
                             CleanupWorker cleanupWorker,
                             Function<Path, SessionOpener> openers,
                             Duration maxDuration,
                             Logger log) {
        this.plan = plan;
        this.controlPlane = controlPlane;
        this.config = config;
        this.cleanupWorker = cleanupWorker;
        this.openers = openers;
        this.maxDuration = maxDuration;
        this.log = log;
    }

    /**
     * Runs the whole lifecycle and returns once the callback returned.
     * Instance termination continues in the background.
     *
     * @throws BurstException the first failure: a phase error, the first setup error
     *                        (others attached as suppressed), or the callback's error
     */
    public void run(FleetCallback callback) {
        Instant started = Instant.now();
        log.info("spinning up fleet {}", plan);
        log.debug("max duration hint is {} (advisory, not enforced)", maxDuration);

        ResourceProvisioner provisioner = new ResourceProvisioner(controlPlane, config, log);
        SpotRequestScheduler scheduler = new SpotRequestScheduler(controlPlane, config.spotPollInterval(), log);
        InstanceReadinessWaiter waiter = new InstanceReadinessWaiter(controlPlane, config.readinessPollInterval(), log);

        boolean guarded = false;
        try (ProvisionedResources resources = provisioner.provision();
             CleanupGuard guard = new CleanupGuard(controlPlane, cleanupWorker,
                     config.cleanupInitialBackoff(), config.cleanupMaxBackoff(), log)) {
            guard.completion().whenComplete((ignored, error) -> cleanupDone.complete(null));
            guarded = true;

            if (config.deleteResourcesOnCleanup()) {
                guard.teardownResources(resources);
            } else {
                log.debug("security group {} and key pair {} will be left in place",
                        resources.securityGroupId(), resources.keyName());
            }

            Resolution resolution = scheduler.schedule(plan, resources, guard::track);
            if (!resolution.fullyActive()) {
                throw rejected(resolution.rejected());
            }

            Map<String, List<FleetInstance>> machines = waiter.awaitReady(resolution.instanceGroups());
            try (SessionOpener opener = openers.apply(resources.privateKeyPath())) {
                try {
                    setUp(machines, opener);
                    invoke(callback, machines);
                } finally {
                    closeSessions(machines);
                }
            }
        } finally {
            if (!guarded) {
                // nothing was launched, so there is no background cleanup to wait for
                cleanupDone.complete(null);
            }
            Duration elapsed = Duration.between(started, Instant.now());
            if (maxDuration != null && elapsed.compareTo(maxDuration) > 0) {
                log.warn("run took {} which exceeds the max duration hint of {}", elapsed, maxDuration);
            }
            log.debug("all done");
        }
    }

    /**
     * Completes once the background cleanup of the last {@link #run} has finished,
     * or right away if that run failed before anything could be launched.
     * Whatever the cleanup talks to, such as the EC2 client, must stay open until then.
     */
    public CompletableFuture<Void> cleanupCompletion() {
        return cleanupDone;
    }

    private void setUp(Map<String, List<FleetInstance>> machines, SessionOpener opener) {
        log.info("all machines instantiated; running setup routines");
        Map<String, SetupRoutine> routines = new LinkedHashMap<>();
        plan.groups().forEach((name, group) -> routines.put(name, group.setup().setup()));

        ParallelSetupExecutor executor = new ParallelSetupExecutor(opener, config.setupParallelism(), log);
        SetupReport report = executor.run(machines, routines);

        if (!report.isClean()) {
            List<BurstException> errors = report.errors();
            log.error("{} of {} instances failed setup", errors.size(), report.attempted());
            BurstException first = errors.get(0);
            for (BurstException other : errors.subList(1, errors.size())) {
                first.addSuppressed(other);
            }
            throw first;
        }
    }

    private void invoke(FleetCallback callback, Map<String, List<FleetInstance>> machines) {
        Map<String, List<FleetInstance>> fleet = new LinkedHashMap<>();
        machines.forEach((name, list) -> fleet.put(name, Collections.unmodifiableList(new ArrayList<>(list))));

        Instant start = Instant.now();
        log.info("quiet before the storm");
        try {
            callback.run(Collections.unmodifiableMap(fleet));
        } catch (Exception e) {
            log.error("main routine failed");
            throw new CallbackException("main routine failed", e);
        }
        log.info("fleet callback finished in {}s", Duration.between(start, Instant.now()).toSeconds());
    }

    private void closeSessions(Map<String, List<FleetInstance>> machines) {
        for (List<FleetInstance> group : machines.values()) {
            for (FleetInstance machine : group) {
                RemoteSession session = machine.detachSession();
                if (session == null) {
                    continue;
                }
                try {
                    session.close();
                } catch (IOException e) {
                    log.warn("Error closing session to {}: {}", machine.publicIp(), e.getMessage());
                }
            }
        }
    }

    private static ResolutionPollingException rejected(List<PendingRequest> rejected) {
        String detail = rejected.stream()
                .map(r -> r.requestId() + " (" + r.group() + ")")
                .collect(Collectors.joining(", "));
        return new ResolutionPollingException(
                rejected.size() + " spot requests were not fulfilled: " + detail);
    }
}
