package burst.ssh;

import burst.cloud.config.BurstConfig;
import burst.error.AuthenticationException;
import burst.error.ConnectionException;
import burst.fleet.model.FleetInstance;
import burst.fleet.setup.SessionOpener;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens authenticated SSH sessions to fleet instances with one shared client and one private key.
 * Thread-safe: setup tasks connect through the same connector concurrently.
 */
public class SshConnector implements SessionOpener {

    private static final Logger log = LoggerFactory.getLogger(SshConnector.class);

    private final SshClient client;
    private final String user;
    private final int port;
    private final int retries;
    private final Duration retryDelay;
    private final Duration connectTimeout;
    private final Duration authTimeout;
    private final List<KeyPair> identities;

    public SshConnector(BurstConfig config, Path privateKey) {
        this(config.sshUser(), config.sshPort(), config.connectRetries(), config.connectRetryDelay(),
                config.connectTimeout(), config.authTimeout(), privateKey);
    }

    public SshConnector(String user, int port, int retries, Duration retryDelay,
                        Duration connectTimeout, Duration authTimeout, Path privateKey) {
        this.user = user;
        this.port = port;
        this.retries = retries;
        this.retryDelay = retryDelay;
        this.connectTimeout = connectTimeout;
        this.authTimeout = authTimeout;
        this.identities = loadIdentities(privateKey);

        this.client = SshClient.setUpDefaultClient();
        // fresh cloud hosts have no known host key to check against
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.start();
    }

    public int port() {
        return port;
    }

    @Override
    public RemoteSession open(FleetInstance instance) {
        return connect(instance.publicIp());
    }

    /**
     * Connects to {@code host}, retrying the TCP connect a fixed number of times,
     * then authenticates with the private key.
     *
     * @throws ConnectionException     if the port never accepted a connection
     * @throws AuthenticationException if the handshake or key authentication failed
     */
    public RemoteSession connect(String host) {
        ClientSession session = openWithRetries(host);
        try {
            for (KeyPair identity : identities) {
                session.addPublicKeyIdentity(identity);
            }
            session.auth().verify(authTimeout.toMillis());
        } catch (IOException | RuntimeException e) {
            closeQuietly(session, host);
            throw new AuthenticationException("failed to authenticate ssh session to " + host + ":" + port, e);
        }
        log.debug("ssh session established to {}:{}", host, port);
        return new SshRemoteSession(session, host, authTimeout.toMillis());
    }

    private ClientSession openWithRetries(String host) {
        IOException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return client.connect(user, host, port)
                        .verify(connectTimeout.toMillis())
                        .getClientSession();
            } catch (IOException e) {
                last = e;
                log.trace("ssh connect to {}:{} failed (attempt {} of {}): {}",
                        host, port, attempt + 1, retries + 1, e.getMessage());
                if (attempt < retries) {
                    pause(host);
                }
            }
        }
        throw new ConnectionException("failed to connect to ssh port " + host + ":" + port
                + " after " + (retries + 1) + " attempts", last);
    }

    private void pause(String host) {
        if (retryDelay.isZero() || retryDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("interrupted while connecting to " + host, e);
        }
    }

    private static List<KeyPair> loadIdentities(Path privateKey) {
        List<KeyPair> keys = new ArrayList<>();
        try {
            for (KeyPair kp : new FileKeyPairProvider(privateKey).loadKeys(null)) {
                keys.add(kp);
            }
        } catch (RuntimeException e) {
            // key parsing errors surface lazily from the iterator as unchecked exceptions
            throw new AuthenticationException("failed to load private key " + privateKey, e);
        }
        if (keys.isEmpty()) {
            throw new AuthenticationException("no private key found in " + privateKey);
        }
        return keys;
    }

    private static void closeQuietly(ClientSession session, String host) {
        try {
            session.close();
        } catch (IOException e) {
            log.warn("Error closing ssh session to {}: {}", host, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            client.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping ssh client: {}", e.getMessage());
        }
    }
}
