package burst.ssh;

import java.io.IOException;

/**
 * Live remote shell on one fleet instance.
 * Commands may be issued from several threads; each call gets its own channel and result.
 */
public interface RemoteSession extends AutoCloseable {

    /**
     * Runs {@code command} on the remote host and waits for its channel to close.
     *
     * @throws IOException if the channel could not be opened or the output not read
     */
    CommandResult exec(String command) throws IOException;

    /**
     * Runs {@code command} and returns everything it wrote to stdout, whatever its exit status.
     */
    default String cmd(String command) throws IOException {
        return exec(command).stdout();
    }

    /** Host this session is connected to. */
    String host();

    @Override
    void close() throws IOException;
}
