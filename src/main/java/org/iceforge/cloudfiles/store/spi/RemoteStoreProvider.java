package org.iceforge.cloudfiles.store.spi;

import org.iceforge.cloudfiles.store.DependencyUnavailableException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;

/**
 * Pluggable source of {@link RemoteStoreClient}s, so the attachment backend never knows how a
 * deployment reaches its object store.
 * <br>
 * Providers are picked up from Spring beans and from
 * <pre>
 * META-INF/services/org.iceforge.cloudfiles.store.spi.RemoteStoreProvider
 * </pre>
 * A plugin JAR dropped on the classpath with such a file is enough to add a store.
 */
public interface RemoteStoreProvider {

    /** A stable ID for configuration and logging (e.g. "s3", "local"). */
    String id();

    /** Return true if this provider should be used for the given context. */
    boolean supports(RemoteStoreContext context);

    /**
     * Build a client for the context.
     *
     * @throws DependencyUnavailableException when the provider's client library is not on the classpath
     */
    RemoteStoreClient client(RemoteStoreContext context);
}
