package burst.cloud.creator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared, read-only resources every instance of a run is launched with.
 * Closing removes the local private key file; the cloud-side group and key pair are left alone.
 */
public record ProvisionedResources(String securityGroupId, String keyName, Path privateKeyPath)
        implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProvisionedResources.class);

    @Override
    public void close() {
        try {
            Files.deleteIfExists(privateKeyPath);
            log.trace("Deleted local private key {}", privateKeyPath);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", privateKeyPath, e.getMessage());
        }
    }
}
