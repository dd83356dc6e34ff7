package org.iceforge.cloudfiles.store.local;

import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.store.ObjectHandle;
import org.iceforge.cloudfiles.store.RemoteObjectNotFoundException;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local filesystem implementation of {@link RemoteStoreSession}.
 *
 * <p>This is intended for dev / integration-test mode so attachments can be stored without any
 * remote account. Paths are mapped as:
 * <pre>
 *   {baseDir}/{container}/{path}
 * </pre>
 * A container is public when {@code {baseDir}/{container}/.public} exists.
 */
public class LocalFsRemoteStoreSession implements RemoteStoreSession {
    private static final Logger log = LoggerFactory.getLogger(LocalFsRemoteStoreSession.class);

    static final String PUBLIC_MARKER = ".public";

    private final Path baseDir;
    private final String cdnTemplate;

    /**
     * @param cdnTemplate public base for a container's objects; {@code {container}} is replaced by the name
     */
    public LocalFsRemoteStoreSession(Path baseDir, String cdnTemplate) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.cdnTemplate = cdnTemplate;
    }

    private Path containerDir(String name) {
        Path p = baseDir.resolve(name).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new RemoteServiceException("Illegal container name: " + name);
        }
        return p;
    }

    private Path pathFor(ContainerHandle container, String path) {
        // Prevent path traversal by normalizing and verifying the container prefix.
        Path root = containerDir(container.name());
        Path p = root.resolve(path).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new RemoteServiceException("Illegal object path (path traversal): container="
                    + container.name() + " path=" + path);
        }
        return p;
    }

    @Override
    public ContainerHandle createContainer(String name) {
        Path dir = containerDir(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RemoteServiceException("createContainer failed: " + name, e);
        }
        boolean published = Files.exists(dir.resolve(PUBLIC_MARKER));
        log.info("Local container {} ready at {}", name, dir);
        return published ? publishedHandle(new ContainerHandle(name, null, null, false))
                : new ContainerHandle(name, null, null, false);
    }

    @Override
    public ContainerHandle makePublic(ContainerHandle container) {
        Path marker = containerDir(container.name()).resolve(PUBLIC_MARKER);
        try {
            if (!Files.exists(marker)) Files.createFile(marker);
        } catch (IOException e) {
            throw new RemoteServiceException("makePublic failed: " + container.name(), e);
        }
        return publishedHandle(container);
    }

    private ContainerHandle publishedHandle(ContainerHandle container) {
        String base = cdnTemplate.replace("{container}", container.name());
        return container.published(base, base.replaceFirst("^http://", "https://"));
    }

    @Override
    public boolean objectExists(ContainerHandle container, String path) {
        return Files.isRegularFile(pathFor(container, path));
    }

    @Override
    public byte[] readObject(ContainerHandle container, String path) {
        try {
            return Files.readAllBytes(pathFor(container, path));
        } catch (NoSuchFileException e) {
            throw new RemoteObjectNotFoundException("Object not found: " + container.name() + "/" + path, e);
        } catch (IOException e) {
            throw new RemoteServiceException("readObject failed: " + container.name() + "/" + path, e);
        }
    }

    @Override
    public ObjectHandle createObject(ContainerHandle container, String path) {
        pathFor(container, path);
        return new ObjectHandle(container, path);
    }

    @Override
    public void loadFromFile(ObjectHandle object, Path localFile) {
        Path dst = pathFor(object.container(), object.path());
        Path tmp = null;
        try {
            Files.createDirectories(dst.getParent());
            tmp = Files.createTempFile(dst.getParent(), "cloudfiles-", ".tmp");
            Files.copy(localFile, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {} from {}", object, localFile);
        } catch (IOException e) {
            deleteTmp(tmp);
            throw new RemoteServiceException("loadFromFile failed: " + object + " from " + localFile, e);
        }
    }

    private static void deleteTmp(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}", tmp, e);
        }
    }

    @Override
    public void deleteObject(ContainerHandle container, String path) {
        try {
            if (!Files.deleteIfExists(pathFor(container, path))) {
                throw new RemoteObjectNotFoundException("Object not found: " + container.name() + "/" + path);
            }
        } catch (IOException e) {
            throw new RemoteServiceException("deleteObject failed: " + container.name() + "/" + path, e);
        }
    }
}
