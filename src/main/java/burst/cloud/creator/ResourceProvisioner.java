package burst.cloud.creator;

import burst.cloud.api.ControlPlane;
import burst.cloud.api.ControlPlaneException;
import burst.cloud.config.BurstConfig;
import burst.cloud.model.IngressRule;
import burst.cloud.model.KeyMaterial;
import burst.error.ProvisioningException;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Creates the security group and key pair shared by every instance of a run,
 * and stores the private key in a temporary file only this process can read.
 */
public class ResourceProvisioner {

    static final String GROUP_DESCRIPTION = "Temporary access groups for burst vms";
    private static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 10;
    private static final int SSH_PORT = 22;

    private final ControlPlane controlPlane;
    private final BurstConfig config;
    private final Logger log;

    public ResourceProvisioner(ControlPlane controlPlane, BurstConfig config, Logger log) {
        this.controlPlane = controlPlane;
        this.config = config;
        this.log = log;
    }

    public ProvisionedResources provision() {
        String groupId = createSecurityGroup();
        KeyMaterial key = createKeyPair();
        Path keyFile = writePrivateKey(key);
        return new ProvisionedResources(groupId, key.keyName(), keyFile);
    }

    private String createSecurityGroup() {
        String groupName = config.securityGroupPrefix() + randomSuffix();
        log.trace("creating security group {}", groupName);

        String groupId;
        try {
            groupId = controlPlane.createSecurityGroup(groupName, GROUP_DESCRIPTION);
        } catch (ControlPlaneException e) {
            throw new ProvisioningException("failed to create security group " + groupName, e);
        }
        if (groupId == null || groupId.isBlank()) {
            throw new ProvisioningException("control plane created security group " + groupName + " with no id");
        }
        log.trace("created security group {} ({})", groupName, groupId);

        // ssh from anywhere, anything from inside the fleet
        authorize(groupId, IngressRule.tcp(SSH_PORT, SSH_PORT, config.sshIngressCidr()), "ssh access");
        authorize(groupId, IngressRule.tcp(0, 65535, config.fleetCidr()), "internal VM access");
        return groupId;
    }

    private void authorize(String groupId, IngressRule rule, String what) {
        log.trace("adding {} to security group {}", what, groupId);
        try {
            controlPlane.authorizeIngress(groupId, rule);
        } catch (ControlPlaneException e) {
            throw new ProvisioningException("failed to fill in security group " + groupId + " (" + what + ")", e);
        }
    }

    private KeyMaterial createKeyPair() {
        String keyName = config.keyNamePrefix() + randomSuffix();
        log.trace("creating keypair {}", keyName);

        KeyMaterial key;
        try {
            key = controlPlane.createKeyPair(keyName);
        } catch (ControlPlaneException e) {
            throw new ProvisioningException("failed to generate key pair " + keyName, e);
        }
        if (key.privateKey() == null || key.privateKey().isBlank()) {
            throw new ProvisioningException("control plane did not generate key material for " + keyName);
        }
        log.trace("created keypair {} with fingerprint {}", key.keyName(), key.fingerprint());
        return key;
    }

    private Path writePrivateKey(KeyMaterial key) {
        try {
            Path file = createOwnerOnlyTempFile();
            Files.writeString(file, key.privateKey(), StandardCharsets.US_ASCII);
            log.trace("wrote keypair to file {}", file);
            return file;
        } catch (IOException e) {
            throw new ProvisioningException("could not write private key for " + key.keyName() + " to a temporary file", e);
        }
    }

    private static Path createOwnerOnlyTempFile() throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile("burst-key-", ".pem",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        }
        Path file = Files.createTempFile("burst-key-", ".pem");
        file.toFile().setReadable(false, false);
        file.toFile().setReadable(true, true);
        return file;
    }

    static String randomSuffix() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHANUMERIC.charAt(rnd.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
