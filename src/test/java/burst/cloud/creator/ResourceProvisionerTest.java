package burst.cloud.creator;

import burst.cloud.config.BurstConfig;
import burst.cloud.model.IngressRule;
import burst.error.ProvisioningException;
import burst.testing.FakeControlPlane;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceProvisionerTest {

    private static final Logger log = LoggerFactory.getLogger(ResourceProvisionerTest.class);

    @Test
    void createsGroupRulesAndKey() throws Exception {
        FakeControlPlane cp = new FakeControlPlane();

        try (ProvisionedResources res = new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision()) {
            assertTrue(res.securityGroupId().startsWith("sg-"));
            assertTrue(res.keyName().startsWith("burst_key_"));
            assertTrue(cp.securityGroups.get(0).startsWith("burst_security_"));
            assertEquals(List.of(
                    IngressRule.tcp(22, 22, "0.0.0.0/0"),
                    IngressRule.tcp(0, 65535, "172.31.0.0/16")), cp.ingressRules);

            assertTrue(Files.exists(res.privateKeyPath()));
            assertTrue(Files.readString(res.privateKeyPath()).contains("BEGIN RSA PRIVATE KEY"));
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                assertEquals(EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE),
                        Files.getPosixFilePermissions(res.privateKeyPath()));
            }
        }
    }

    @Test
    void closeDeletesKeyFile() {
        FakeControlPlane cp = new FakeControlPlane();
        ProvisionedResources res = new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision();

        res.close();

        assertFalse(Files.exists(res.privateKeyPath()));
    }

    @Test
    void namesAreRandomPerRun() {
        FakeControlPlane cp = new FakeControlPlane();
        ResourceProvisioner provisioner = new ResourceProvisioner(cp, BurstConfig.defaults(), log);

        try (ProvisionedResources a = provisioner.provision(); ProvisionedResources b = provisioner.provision()) {
            assertNotEquals(a.keyName(), b.keyName());
            assertNotEquals(cp.securityGroups.get(0), cp.securityGroups.get(1));
        }
    }

    @Test
    void suffixIsTenAlphanumerics() {
        String suffix = ResourceProvisioner.randomSuffix();

        assertEquals(10, suffix.length());
        assertTrue(suffix.matches("[A-Za-z0-9]{10}"));
    }

    @Test
    void groupFailureIsProvisioningError() {
        FakeControlPlane cp = new FakeControlPlane().failOn("group");

        ProvisioningException ex = assertThrows(ProvisioningException.class,
                () -> new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision());
        assertTrue(ex.getMessage().contains("security group"));
        assertTrue(cp.keyPairs.isEmpty());
    }

    @Test
    void ingressFailureIsProvisioningError() {
        FakeControlPlane cp = new FakeControlPlane().failOn("ingress");

        assertThrows(ProvisioningException.class,
                () -> new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision());
    }

    @Test
    void keyFailureIsProvisioningError() {
        FakeControlPlane cp = new FakeControlPlane().failOn("key");

        ProvisioningException ex = assertThrows(ProvisioningException.class,
                () -> new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision());
        assertTrue(ex.getMessage().contains("key pair"));
    }

    @Test
    void missingKeyMaterialIsProvisioningError() {
        FakeControlPlane cp = new FakeControlPlane().keyMaterial("");

        assertThrows(ProvisioningException.class,
                () -> new ResourceProvisioner(cp, BurstConfig.defaults(), log).provision());
    }
}
