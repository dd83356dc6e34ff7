package org.iceforge.cloudfiles.attachment;

import org.iceforge.cloudfiles.credentials.CloudFilesCredentials;
import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.store.ObjectHandle;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.iceforge.cloudfiles.url.CdnUrlBuilder;
import org.iceforge.cloudfiles.url.SslPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Stores one attachment's styles as objects in a remote container.
 *
 * <p>Reads and existence checks go straight to the store. Writes and deletes are queued and
 * only reach the store when the host calls {@link #flushWrites()} / {@link #flushDeletes()}
 * during save and destroy.
 *
 * <p>{@link #read(String)} and {@link #exists(String)} never look at queued writes, so content
 * assigned but not yet flushed is not visible through them. {@link #toFile(String)} does
 * return a queued file.
 *
 * <p>Instances come from {@link CloudFilesStorageFactory#activate}; the credentials, container
 * and CDN bases are fixed at that point.
 */
public class CloudFilesAttachmentStorage<T> {
    private static final Logger log = LoggerFactory.getLogger(CloudFilesAttachmentStorage.class);

    private final AttachmentContext<T> attachment;
    private final CloudFilesCredentials credentials;
    private final ContainerHandle container;
    private final RemoteStoreSession session;
    private final CdnUrlBuilder urls;
    private final SslPolicy<T> ssl;
    private final String pathTemplate;
    private final WriteDeleteQueue queue = new WriteDeleteQueue();

    CloudFilesAttachmentStorage(AttachmentContext<T> attachment,
                                CloudFilesCredentials credentials,
                                ContainerHandle container,
                                RemoteStoreSession session,
                                CdnUrlBuilder urls,
                                SslPolicy<T> ssl,
                                String pathTemplate) {
        this.attachment = attachment;
        this.credentials = credentials;
        this.container = container;
        this.session = session;
        this.urls = urls;
        this.ssl = ssl;
        this.pathTemplate = pathTemplate;
    }

    public boolean exists() {
        return exists(attachment.defaultStyle());
    }

    public boolean exists(String style) {
        return session.objectExists(container, attachment.path(style));
    }

    public byte[] read() {
        return read(attachment.defaultStyle());
    }

    public byte[] read(String style) {
        return session.readObject(container, attachment.path(style));
    }

    public Path toFile() {
        return toFile(attachment.defaultStyle());
    }

    /**
     * The queued local file for {@code style} if there is one, otherwise a new temp file holding
     * the stored object. A downloaded temp file belongs to the caller, who deletes it.
     */
    public Path toFile(String style) {
        var queued = queue.pendingWrite(style);
        if (queued.isPresent()) return queued.get();

        String path = attachment.path(style);
        byte[] data = session.readObject(container, path);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(tempPrefix(path), extension(path));
            Files.write(tmp, data);
            return tmp;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write temp file for " + container.name() + "/" + path, e);
        }
    }

    public String url() {
        return url(attachment.defaultStyle());
    }

    public String url(String style) {
        boolean useSsl = ssl.useSsl(attachment.owner());
        return urls.objectUrl(container, useSsl, attachment.path(style));
    }

    public void queueWrite(String style, Path localFile) {
        queue.queueWrite(style, localFile);
    }

    public void queueDelete(String objectPath) {
        queue.queueDelete(objectPath);
    }

    /** Queues the current object path of every given style for deletion. */
    public void queueDeleteStyles(Collection<String> styles) {
        for (String style : styles) {
            queue.queueDelete(attachment.path(style));
        }
    }

    /**
     * Uploads every queued write to the object path of its style.
     *
     * @throws RemoteServiceException from the first failing upload; it and later writes stay queued
     */
    public void flushWrites() {
        int n = queue.flushWrites((style, file) -> {
            ObjectHandle object = session.createObject(container, attachment.path(style));
            session.loadFromFile(object, file);
            log.debug("Uploaded {} style {} to {}", attachment.name(), style, object);
        });
        if (n > 0) log.info("Uploaded {} object(s) for {} to container {}", n, attachment.name(), container.name());
    }

    /**
     * Deletes every queued object path. Objects that are already gone are skipped.
     *
     * @throws RemoteServiceException from the first failing delete; it and later deletes stay queued
     */
    public void flushDeletes() {
        int n = queue.flushDeletes(path -> session.deleteObject(container, path));
        if (n > 0) log.info("Deleted {} object(s) for {} from container {}", n, attachment.name(), container.name());
    }

    public Map<String, Path> pendingWrites() {
        return queue.pendingWrites();
    }

    public List<String> pendingDeletes() {
        return queue.pendingDeletes();
    }

    public boolean isClean() {
        return queue.isClean();
    }

    public String containerName() {
        return container.name();
    }

    public ContainerHandle container() {
        return container;
    }

    public CloudFilesCredentials credentials() {
        return credentials;
    }

    /**
     * Object path template for this attachment, {@link PathTokens#DEFAULT_PATH} unless one was
     * configured explicitly. Object paths themselves always come from {@link AttachmentContext#path};
     * the host interpolates this template when computing them.
     */
    public String pathTemplate() {
        return pathTemplate;
    }

    static String tempPrefix(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base.isEmpty() ? "cloudfiles" : base;
    }

    static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", p, e);
        }
    }
}
