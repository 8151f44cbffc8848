package burst.fleet.model;

import burst.cloud.model.InstanceDescription;
import burst.ssh.RemoteSession;

import java.util.Objects;
import java.util.Optional;

/**
 * A running, fully addressed fleet instance.
 * The session is attached by the setup phase and closed once the fleet callback returns;
 * the cloud instance itself is terminated by the cleanup guard.
 */
public final class FleetInstance {
    private final String instanceId;
    private final String group;
    private final String instanceType;
    private final String privateIp;
    private final String publicIp;
    private final String publicDns;

    private volatile RemoteSession session;

    public FleetInstance(String instanceId, String group, String instanceType,
                         String privateIp, String publicIp, String publicDns) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId is required");
        this.group = Objects.requireNonNull(group, "group is required");
        this.instanceType = Objects.requireNonNull(instanceType, "instanceType is required");
        this.privateIp = Objects.requireNonNull(privateIp, "privateIp is required");
        this.publicIp = Objects.requireNonNull(publicIp, "publicIp is required");
        this.publicDns = Objects.requireNonNull(publicDns, "publicDns is required");
    }

    public static FleetInstance from(InstanceDescription d, String group) {
        if (!d.isFullyAddressed()) {
            throw new IllegalArgumentException("instance " + d.instanceId() + " is not fully addressed");
        }
        return new FleetInstance(d.instanceId(), group, d.instanceType(),
                d.privateIp(), d.publicIp(), d.publicDns());
    }

    public String instanceId() {
        return instanceId;
    }

    public String group() {
        return group;
    }

    public String instanceType() {
        return instanceType;
    }

    public String privateIp() {
        return privateIp;
    }

    public String publicIp() {
        return publicIp;
    }

    public String publicDns() {
        return publicDns;
    }

    /** Session opened during setup; empty before setup ran or after the run returned. */
    public Optional<RemoteSession> session() {
        return Optional.ofNullable(session);
    }

    public void attachSession(RemoteSession session) {
        this.session = session;
    }

    /** Detaches and returns the session, if any. */
    public RemoteSession detachSession() {
        RemoteSession s = this.session;
        this.session = null;
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FleetInstance other))
            return false;
        return instanceId.equals(other.instanceId);
    }

    @Override
    public int hashCode() {
        return instanceId.hashCode();
    }

    @Override
    public String toString() {
        return "FleetInstance{id='" + instanceId + "', group='" + group + "', ip=" + publicIp + "}";
    }
}
