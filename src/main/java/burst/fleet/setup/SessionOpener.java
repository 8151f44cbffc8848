package burst.fleet.setup;

import burst.fleet.model.FleetInstance;
import burst.ssh.RemoteSession;

/**
 * Opens an authenticated remote session to one fleet instance.
 * Implementations throw {@link burst.error.ConnectionException} or
 * {@link burst.error.AuthenticationException} on failure.
 */
@FunctionalInterface
public interface SessionOpener extends AutoCloseable {

    RemoteSession open(FleetInstance instance);

    /** Releases whatever the opener holds; sessions it opened are closed separately. */
    @Override
    default void close() {
    }
}
