package burst.cloud.model;

/**
 * Snapshot of one instance as reported by "describe instances".
 * Any field may be null while the instance is still booting.
 */
public record InstanceDescription(
        String instanceId,
        String instanceType,
        String privateIp,
        String publicDns,
        String publicIp
) {

    /** True once every addressing field is present and non-blank. */
    public boolean isFullyAddressed() {
        return present(instanceId)
                && present(instanceType)
                && present(privateIp)
                && present(publicDns)
                && present(publicIp);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
