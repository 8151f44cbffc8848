package burst.cloud.config;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration holder for a fleet run.
 * All settings have sensible defaults.
 */
public final class BurstConfig {

    // AWS
    private String region = "us-east-1";
    private URI endpointOverride; // null means the regional EC2 endpoint

    // SSH
    private String sshUser = "ec2-user";
    private int sshPort = 22;
    private int connectRetries = 4; // retries after the first attempt
    private Duration connectRetryDelay = Duration.ofSeconds(2);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration authTimeout = Duration.ofSeconds(30);

    // Polling
    private Duration spotPollInterval = Duration.ofSeconds(1);
    private Duration readinessPollInterval = Duration.ofSeconds(1);

    // Setup
    private int setupParallelism = Runtime.getRuntime().availableProcessors();

    // Cleanup
    private Duration cleanupInitialBackoff = Duration.ofMillis(200);
    private Duration cleanupMaxBackoff = Duration.ofSeconds(10);
    private Duration cleanupGracePeriod = Duration.ofSeconds(30);
    private boolean deleteResourcesOnCleanup = false;

    // Network
    private String sshIngressCidr = "0.0.0.0/0";
    private String fleetCidr = "172.31.0.0/16";
    private String securityGroupPrefix = "burst_security_";
    private String keyNamePrefix = "burst_key_";

    private BurstConfig() {
    }

    public static BurstConfig defaults() {
        return new BurstConfig();
    }

    public static BurstConfig fromEnv() {
        return defaults().overrideFromEnv();
    }

    /**
     * Applies {@code BURST_*} environment variables on top of the current values.
     */
    public BurstConfig overrideFromEnv() {
        String region = System.getenv("BURST_REGION");
        if (region != null && !region.isBlank()) {
            this.region = region.trim();
        }

        String endpoint = System.getenv("BURST_EC2_ENDPOINT");
        if (endpoint != null && !endpoint.isBlank()) {
            this.endpointOverride = URI.create(endpoint.trim());
        }

        String user = System.getenv("BURST_SSH_USER");
        if (user != null && !user.isBlank()) {
            this.sshUser = user.trim();
        }

        String parallelism = System.getenv("BURST_SETUP_PARALLELISM");
        if (parallelism != null && !parallelism.isBlank()) {
            this.setupParallelism = Integer.parseInt(parallelism.trim());
        }

        String deleteResources = System.getenv("BURST_DELETE_RESOURCES");
        if (deleteResources != null && !deleteResources.isBlank()) {
            this.deleteResourcesOnCleanup = Boolean.parseBoolean(deleteResources.trim());
        }

        return this;
    }

    // Getters
    public String region() {
        return region;
    }

    public URI endpointOverride() {
        return endpointOverride;
    }

    public String sshUser() {
        return sshUser;
    }

    public int sshPort() {
        return sshPort;
    }

    public int connectRetries() {
        return connectRetries;
    }

    public Duration connectRetryDelay() {
        return connectRetryDelay;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration authTimeout() {
        return authTimeout;
    }

    public Duration spotPollInterval() {
        return spotPollInterval;
    }

    public Duration readinessPollInterval() {
        return readinessPollInterval;
    }

    public int setupParallelism() {
        return setupParallelism;
    }

    public Duration cleanupInitialBackoff() {
        return cleanupInitialBackoff;
    }

    public Duration cleanupMaxBackoff() {
        return cleanupMaxBackoff;
    }

    public Duration cleanupGracePeriod() {
        return cleanupGracePeriod;
    }

    public boolean deleteResourcesOnCleanup() {
        return deleteResourcesOnCleanup;
    }

    public String sshIngressCidr() {
        return sshIngressCidr;
    }

    public String fleetCidr() {
        return fleetCidr;
    }

    public String securityGroupPrefix() {
        return securityGroupPrefix;
    }

    public String keyNamePrefix() {
        return keyNamePrefix;
    }

    // Fluent setters for testing/customization
    public BurstConfig withRegion(String region) {
        this.region = region;
        return this;
    }

    public BurstConfig withEndpointOverride(URI endpoint) {
        this.endpointOverride = endpoint;
        return this;
    }

    public BurstConfig withSshUser(String sshUser) {
        this.sshUser = sshUser;
        return this;
    }

    public BurstConfig withSshPort(int sshPort) {
        this.sshPort = sshPort;
        return this;
    }

    public BurstConfig withConnectRetries(int connectRetries) {
        if (connectRetries < 0) {
            throw new IllegalArgumentException("connectRetries must be non-negative");
        }
        this.connectRetries = connectRetries;
        return this;
    }

    public BurstConfig withConnectRetryDelay(Duration delay) {
        this.connectRetryDelay = delay;
        return this;
    }

    public BurstConfig withConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public BurstConfig withAuthTimeout(Duration authTimeout) {
        this.authTimeout = authTimeout;
        return this;
    }

    public BurstConfig withSpotPollInterval(Duration interval) {
        this.spotPollInterval = interval;
        return this;
    }

    public BurstConfig withReadinessPollInterval(Duration interval) {
        this.readinessPollInterval = interval;
        return this;
    }

    public BurstConfig withSetupParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("setupParallelism must be positive");
        }
        this.setupParallelism = parallelism;
        return this;
    }

    public BurstConfig withCleanupBackoff(Duration initial, Duration max) {
        this.cleanupInitialBackoff = initial;
        this.cleanupMaxBackoff = max;
        return this;
    }

    public BurstConfig withCleanupGracePeriod(Duration gracePeriod) {
        this.cleanupGracePeriod = gracePeriod;
        return this;
    }

    public BurstConfig withDeleteResourcesOnCleanup(boolean delete) {
        this.deleteResourcesOnCleanup = delete;
        return this;
    }

    public BurstConfig withSshIngressCidr(String cidr) {
        this.sshIngressCidr = cidr;
        return this;
    }

    public BurstConfig withFleetCidr(String cidr) {
        this.fleetCidr = cidr;
        return this;
    }

    public BurstConfig withSecurityGroupPrefix(String prefix) {
        this.securityGroupPrefix = prefix;
        return this;
    }

    public BurstConfig withKeyNamePrefix(String prefix) {
        this.keyNamePrefix = prefix;
        return this;
    }

    @Override
    public String toString() {
        return "BurstConfig{" +
                "region='" + region + '\'' +
                ", sshUser='" + sshUser + '\'' +
                ", sshPort=" + sshPort +
                ", setupParallelism=" + setupParallelism +
                ", deleteResourcesOnCleanup=" + deleteResourcesOnCleanup +
                '}';
    }
}
