package burst;

import burst.cloud.api.ControlPlane;
import burst.cloud.api.Ec2ControlPlane;
import burst.cloud.auth.AuthService;
import burst.cloud.config.BurstConfig;
import burst.fleet.FleetOrchestrator;
import burst.fleet.cleanup.CleanupWorker;
import burst.fleet.model.FleetCallback;
import burst.fleet.model.FleetPlan;
import burst.fleet.model.MachineSetup;
import burst.fleet.setup.SessionOpener;
import burst.ssh.SshConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Entry point: describe the machine groups, then {@link #run(FleetCallback)} a transient fleet.
 *
 * <pre>
 * Burst.builder()
 *         .addSet("workers", 2, new MachineSetup("t3.small", "ami-0abc", s -> s.cmd("sudo yum install -y git")))
 *         .addSet("leader", 1, new MachineSetup("t3.small", "ami-0abc", SetupRoutine.noop()))
 *         .maxDurationHours(1)
 *         .build()
 *         .run(fleet -> fleet.get("leader").get(0).session().orElseThrow().cmd("./bench.sh"));
 * </pre>
 */
public final class Burst {

    private static final Logger defaultLog = LoggerFactory.getLogger(Burst.class);

    private final FleetPlan plan;
    private final BurstConfig config;
    private final ControlPlane controlPlane;
    private final CleanupWorker cleanupWorker;
    private final AwsCredentialsProvider credentials;
    private final Function<Path, SessionOpener> openers;
    private final Duration maxDuration;
    private final Logger log;

    private Burst(Builder builder) {
        this.plan = builder.plan.build();
        this.config = builder.config;
        this.controlPlane = builder.controlPlane;
        this.cleanupWorker = builder.cleanupWorker;
        this.credentials = builder.credentials;
        this.openers = builder.openers;
        this.maxDuration = builder.maxDuration;
        this.log = builder.log;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FleetPlan plan() {
        return plan;
    }

    /**
     * Provisions the fleet, sets it up, hands it to {@code callback}, and arranges termination.
     *
     * @throws burst.error.BurstException if any phase, any setup routine, or the callback failed
     */
    public void run(FleetCallback callback) {
        if (plan.isEmpty()) {
            throw new IllegalStateException("no machine sets were added");
        }
        CleanupWorker worker = cleanupWorker != null
                ? cleanupWorker
                : CleanupWorker.shared(config.cleanupGracePeriod());
        Function<Path, SessionOpener> sessionOpeners = openers != null
                ? openers
                : privateKey -> new SshConnector(config, privateKey);

        if (controlPlane != null) {
            new FleetOrchestrator(plan, controlPlane, config, worker, sessionOpeners, maxDuration, log).run(callback);
            return;
        }

        log.debug("connecting to ec2 in {}", config.region());
        AuthService auth = credentials != null ? new AuthService(config, credentials) : new AuthService(config);
        FleetOrchestrator orchestrator = new FleetOrchestrator(
                plan, new Ec2ControlPlane(auth), config, worker, sessionOpeners, maxDuration, log);
        try {
            orchestrator.run(callback);
        } finally {
            // termination runs in the background on this client
            orchestrator.cleanupCompletion().whenComplete((ignored, error) -> auth.close());
        }
    }

    public static final class Builder {
        private final FleetPlan.Builder plan = FleetPlan.builder();
        private BurstConfig config = BurstConfig.defaults();
        private ControlPlane controlPlane;
        private CleanupWorker cleanupWorker;
        private AwsCredentialsProvider credentials;
        private Function<Path, SessionOpener> openers;
        private Duration maxDuration = Duration.ofHours(1);
        private Logger log = defaultLog;

        /** Adds a named machine set of {@code count} machines. Names must be unique. */
        public Builder addSet(String name, int count, MachineSetup setup) {
            plan.add(name, count, setup);
            return this;
        }

        /** Advisory only; a warning is logged when a run outlives it. */
        public Builder maxDurationHours(int hours) {
            this.maxDuration = Duration.ofHours(hours);
            return this;
        }

        public Builder maxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
            return this;
        }

        public Builder logger(Logger log) {
            this.log = log;
            return this;
        }

        public Builder config(BurstConfig config) {
            this.config = config;
            return this;
        }

        public Builder controlPlane(ControlPlane controlPlane) {
            this.controlPlane = controlPlane;
            return this;
        }

        /** Credentials for the EC2 client; environment variables when unset. */
        public Builder credentials(AwsCredentialsProvider credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder cleanupWorker(CleanupWorker cleanupWorker) {
            this.cleanupWorker = cleanupWorker;
            return this;
        }

        /** Replaces SSH with another way of opening sessions, given the private key path. */
        public Builder sessionOpeners(Function<Path, SessionOpener> openers) {
            this.openers = openers;
            return this;
        }

        public Burst build() {
            return new Burst(this);
        }
    }
}
