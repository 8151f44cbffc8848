package burst.cloud.api;

import burst.cloud.model.IngressRule;
import burst.cloud.model.InstanceDescription;
import burst.cloud.model.KeyMaterial;
import burst.cloud.model.LaunchSpec;
import burst.cloud.model.SpotRequestStatus;

import java.util.Collection;
import java.util.List;

/**
 * Calls a fleet run makes against the cloud control plane.
 * Every method throws {@link ControlPlaneException} when the provider rejects the call.
 */
public interface ControlPlane {

    /** @return id of the new security group */
    String createSecurityGroup(String name, String description);

    void authorizeIngress(String securityGroupId, IngressRule rule);

    KeyMaterial createKeyPair(String keyName);

    /**
     * Submits one spot request for {@code count} instances.
     *
     * @return ids of the spot requests created
     */
    List<String> requestSpotInstances(LaunchSpec spec, int count);

    List<SpotRequestStatus> describeSpotRequests(Collection<String> requestIds);

    void cancelSpotRequests(Collection<String> requestIds);

    List<InstanceDescription> describeInstances(Collection<String> instanceIds);

    void terminateInstances(Collection<String> instanceIds);

    void deleteSecurityGroup(String securityGroupId);

    void deleteKeyPair(String keyName);
}
