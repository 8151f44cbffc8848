package burst.ssh;

import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

/**
 * {@link RemoteSession} over an authenticated Apache MINA SSHD client session.
 */
public final class SshRemoteSession implements RemoteSession {

    private static final Logger log = LoggerFactory.getLogger(SshRemoteSession.class);

    private final ClientSession session;
    private final String host;
    private final long openTimeoutMillis;

    SshRemoteSession(ClientSession session, String host, long openTimeoutMillis) {
        this.session = session;
        this.host = host;
        this.openTimeoutMillis = openTimeoutMillis;
    }

    @Override
    public CommandResult exec(String command) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        Integer exitStatus;

        try (ChannelExec channel = session.createExecChannel(command)) {
            channel.setOut(out);
            channel.setErr(err);
            try {
                channel.open().verify(openTimeoutMillis);
            } catch (IOException e) {
                throw new IOException("failed to execute command '" + command + "'", e);
            }

            channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), 0L);
            exitStatus = channel.getExitStatus();
        }

        CommandResult result = new CommandResult(
                out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8), exitStatus);
        if (exitStatus != null && exitStatus != 0) {
            log.debug("command '{}' on {} exited with {}: {}", command, host, exitStatus, result.stderr().trim());
        }
        return result;
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public void close() throws IOException {
        session.close();
    }
}
