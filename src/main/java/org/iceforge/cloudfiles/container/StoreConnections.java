package org.iceforge.cloudfiles.container;

import org.iceforge.cloudfiles.credentials.CloudFilesCredentials;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide store state shared by every attachment backend: one authenticated session per
 * account and one {@link ContainerRegistry} per session.
 *
 * <p>Construct once (the auto-configuration registers a singleton) and pass it to each backend.
 * Tests create a fresh instance to start from an empty cache.
 */
public class StoreConnections implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreConnections.class);

    private final RemoteStoreClient client;
    private final ConcurrentHashMap<AccountKey, Connection> connections = new ConcurrentHashMap<>();

    public StoreConnections(RemoteStoreClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /** Authenticates on first use for the account, then returns the cached session. */
    public RemoteStoreSession session(CloudFilesCredentials credentials) {
        return connection(credentials).registry().session();
    }

    public ContainerRegistry containers(CloudFilesCredentials credentials) {
        return connection(credentials).registry();
    }

    private Connection connection(CloudFilesCredentials credentials) {
        return connections.computeIfAbsent(AccountKey.of(credentials), Connection::new);
    }

    @Override
    public void close() {
        for (Connection c : connections.values()) {
            c.close();
        }
        connections.clear();
    }

    private record AccountKey(String username, String apiKey, boolean servicenet, URI authUrl) {
        static AccountKey of(CloudFilesCredentials c) {
            return new AccountKey(c.username(), c.apiKey(), c.servicenet(), c.authUrl().orElse(null));
        }

        @Override
        public String toString() {
            return username + "@" + (authUrl == null ? "<default>" : authUrl) + (servicenet ? " (servicenet)" : "");
        }
    }

    private final class Connection {
        private final AccountKey key;
        private ContainerRegistry registry;

        Connection(AccountKey key) {
            this.key = key;
        }

        synchronized ContainerRegistry registry() {
            if (registry == null) {
                RemoteStoreSession session = client.authenticate(key.username(), key.apiKey(), key.servicenet(), key.authUrl());
                log.info("Authenticated store session for {}", key);
                registry = new ContainerRegistry(session);
            }
            return registry;
        }

        synchronized void close() {
            if (registry != null) {
                registry.session().close();
                registry = null;
            }
        }
    }
}
