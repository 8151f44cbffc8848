package burst.fleet.model;

import burst.ssh.RemoteSession;

/**
 * Per-group setup run once on every instance of the group before the fleet callback.
 * Implementations must not share mutable state across groups; the same routine is
 * invoked concurrently for every instance of its group.
 */
@FunctionalInterface
public interface SetupRoutine {

    void setup(RemoteSession session) throws Exception;

    static SetupRoutine noop() {
        return session -> {
        };
    }
}
