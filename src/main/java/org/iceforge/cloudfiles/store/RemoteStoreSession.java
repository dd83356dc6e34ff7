package org.iceforge.cloudfiles.store;

import java.nio.file.Path;

/**
 * Authenticated container/object operations. Every call is a blocking round trip with no
 * built-in retry; failures surface as {@link RemoteServiceException}.
 * <p>
 * Sessions are shared by all attachments using the same account and must be thread-safe.
 */
public interface RemoteStoreSession extends AutoCloseable {

    /** Creates the container, or returns it when the account already owns one with that name. */
    ContainerHandle createContainer(String name);

    /** Enables anonymous CDN reads and returns the handle with its CDN prefixes filled in. */
    ContainerHandle makePublic(ContainerHandle container);

    boolean objectExists(ContainerHandle container, String path);

    /** @throws RemoteObjectNotFoundException when nothing is stored at {@code path} */
    byte[] readObject(ContainerHandle container, String path);

    /** Prepares an object for upload. Does not contact the store. */
    ObjectHandle createObject(ContainerHandle container, String path);

    /** Creates or overwrites the object's content from a local file. */
    void loadFromFile(ObjectHandle object, Path localFile);

    /** @throws RemoteObjectNotFoundException when nothing is stored at {@code path} */
    void deleteObject(ContainerHandle container, String path);

    /** Releases connections held by the session. */
    @Override
    default void close() {}
}
