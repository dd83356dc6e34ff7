package org.iceforge.cloudfiles.container;

import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Containers of one session, created and published at most once per name.
 *
 * <p>A miss takes a lock for that name only, re-checks the cache, then runs
 * create-then-publish. Callers racing on the same uncached name wait for the first one and
 * share its handle; other names are never blocked. Cache hits take no lock and do not
 * re-check visibility.
 */
public class ContainerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContainerRegistry.class);

    private final RemoteStoreSession session;
    private final ConcurrentHashMap<String, ContainerHandle> containers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> creationLocks = new ConcurrentHashMap<>();

    public ContainerRegistry(RemoteStoreSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * @throws RemoteServiceException when creating or publishing fails; nothing is cached then
     */
    public ContainerHandle getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Container name must not be blank");
        }
        ContainerHandle cached = containers.get(name);
        if (cached != null) return cached;

        ReentrantLock lock = creationLocks.computeIfAbsent(name, k -> new ReentrantLock());
        lock.lock();
        try {
            cached = containers.get(name);
            if (cached != null) return cached;

            ContainerHandle created = session.createContainer(name);
            ContainerHandle published = session.makePublic(created);
            containers.put(name, published);
            log.info("Container {} created and published (cdn={}, ssl={})",
                    name, published.cdnUrl(), published.cdnSslUrl());
            return published;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ContainerHandle> cached(String name) {
        return Optional.ofNullable(containers.get(name));
    }

    public void evict(String name) {
        containers.remove(name);
    }

    public RemoteStoreSession session() {
        return session;
    }
}
