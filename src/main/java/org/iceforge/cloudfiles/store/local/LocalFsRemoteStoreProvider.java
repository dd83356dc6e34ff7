package org.iceforge.cloudfiles.store.local;

import org.iceforge.cloudfiles.credentials.ConfigurationException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.spi.RemoteStoreContext;
import org.iceforge.cloudfiles.store.spi.RemoteStoreProvider;

import java.nio.file.Path;

/**
 * Activates when the context names a local base directory, or when forced with
 * {@code cloudfiles.provider=local}.
 */
public final class LocalFsRemoteStoreProvider implements RemoteStoreProvider {

    static final String DEFAULT_CDN_TEMPLATE = "http://localhost:8080/cloudfiles/{container}";

    @Override
    public String id() {
        return "local";
    }

    @Override
    public boolean supports(RemoteStoreContext context) {
        return context.localBaseDir().isPresent() || "local".equals(context.tags().get("store"));
    }

    @Override
    public RemoteStoreClient client(RemoteStoreContext context) {
        Path baseDir = context.localBaseDir()
                .orElseThrow(() -> new ConfigurationException("cloudfiles.local-base-dir is required for the local store"));
        return new LocalFsRemoteStoreClient(baseDir, context.cdnBaseUrl().orElse(DEFAULT_CDN_TEMPLATE));
    }
}
