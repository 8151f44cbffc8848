package burst.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads run settings from an INI file.
 * Supports sections [AWS], [SSH], [POLLING], [SETUP], [CLEANUP], [NETWORK]; all optional,
 * missing keys keep their defaults.
 *
 * <pre>
 * [AWS]
 * region = eu-west-1
 * endpoint = http://localhost:4566
 *
 * [SSH]
 * user = ubuntu
 * connect_retries = 4
 * connect_timeout_ms = 10000
 *
 * [CLEANUP]
 * max_backoff_ms = 10000
 * delete_resources = true
 * </pre>
 */
public class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    public static Optional<BurstConfig> load(File file) {
        try {
            Ini ini = new Ini(file);

            Profile.Section aws     = ini.get("AWS");
            Profile.Section ssh     = ini.get("SSH");
            Profile.Section polling = ini.get("POLLING");
            Profile.Section setup   = ini.get("SETUP");
            Profile.Section cleanup = ini.get("CLEANUP");
            Profile.Section net     = ini.get("NETWORK");

            BurstConfig cfg = BurstConfig.defaults();

            // AWS
            String region = opt(aws, "region");
            if (region != null) cfg.withRegion(region);
            String endpoint = opt(aws, "endpoint");
            if (endpoint != null) cfg.withEndpointOverride(URI.create(endpoint));

            // SSH
            String user = opt(ssh, "user");
            if (user != null) cfg.withSshUser(user);
            String port = opt(ssh, "port");
            if (port != null) cfg.withSshPort(Integer.parseInt(port));
            String retries = opt(ssh, "connect_retries");
            if (retries != null) cfg.withConnectRetries(Integer.parseInt(retries));
            Duration retryDelay = millis(ssh, "connect_retry_delay_ms");
            if (retryDelay != null) cfg.withConnectRetryDelay(retryDelay);
            Duration connectTimeout = millis(ssh, "connect_timeout_ms");
            if (connectTimeout != null) cfg.withConnectTimeout(connectTimeout);
            Duration authTimeout = millis(ssh, "auth_timeout_ms");
            if (authTimeout != null) cfg.withAuthTimeout(authTimeout);

            // POLLING
            Duration spotPoll = millis(polling, "spot_interval_ms");
            if (spotPoll != null) cfg.withSpotPollInterval(spotPoll);
            Duration readyPoll = millis(polling, "readiness_interval_ms");
            if (readyPoll != null) cfg.withReadinessPollInterval(readyPoll);

            // SETUP
            String parallelism = opt(setup, "parallelism");
            if (parallelism != null) cfg.withSetupParallelism(Integer.parseInt(parallelism));

            // CLEANUP
            Duration initial = millis(cleanup, "initial_backoff_ms");
            Duration max = millis(cleanup, "max_backoff_ms");
            if (initial != null || max != null) {
                cfg.withCleanupBackoff(
                        initial != null ? initial : cfg.cleanupInitialBackoff(),
                        max != null ? max : cfg.cleanupMaxBackoff());
            }
            Duration grace = millis(cleanup, "grace_period_ms");
            if (grace != null) cfg.withCleanupGracePeriod(grace);
            cfg.withDeleteResourcesOnCleanup(Boolean.parseBoolean(opt(cleanup, "delete_resources", "false")));

            // NETWORK
            String sshCidr = opt(net, "ssh_cidr");
            if (sshCidr != null) cfg.withSshIngressCidr(sshCidr);
            String fleetCidr = opt(net, "fleet_cidr");
            if (fleetCidr != null) cfg.withFleetCidr(fleetCidr);
            String groupPrefix = opt(net, "security_group_prefix");
            if (groupPrefix != null) cfg.withSecurityGroupPrefix(groupPrefix);
            String keyPrefix = opt(net, "key_prefix");
            if (keyPrefix != null) cfg.withKeyNamePrefix(keyPrefix);

            return Optional.of(cfg);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load config from {}", file, ex);
            return Optional.empty();
        }
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static Duration millis(Profile.Section s, String key) {
        String v = opt(s, key);
        return v == null ? null : Duration.ofMillis(Long.parseLong(v));
    }
}
