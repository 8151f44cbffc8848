package burst.cloud.model;

import java.util.Objects;

/**
 * Launch specification attached to a spot request.
 */
public record LaunchSpec(String imageId, String instanceType, String securityGroupId, String keyName) {

    public LaunchSpec {
        Objects.requireNonNull(imageId, "imageId is required");
        Objects.requireNonNull(instanceType, "instanceType is required");
        Objects.requireNonNull(securityGroupId, "securityGroupId is required");
        Objects.requireNonNull(keyName, "keyName is required");
    }
}
