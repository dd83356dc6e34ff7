package org.iceforge.cloudfiles.store.local;

import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Store rooted in a local directory. Credentials are accepted as-is; the user name only shows up in logs.
 */
public class LocalFsRemoteStoreClient implements RemoteStoreClient {
    private static final Logger log = LoggerFactory.getLogger(LocalFsRemoteStoreClient.class);

    private final Path baseDir;
    private final String cdnTemplate;

    public LocalFsRemoteStoreClient(Path baseDir, String cdnTemplate) {
        this.baseDir = baseDir;
        this.cdnTemplate = cdnTemplate;
    }

    @Override
    public RemoteStoreSession authenticate(String username, String apiKey, boolean useServiceNet, URI authUrl) {
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new RemoteServiceException("Failed to create local store directory " + baseDir, e);
        }
        log.info("Using LOCAL object store for user={}: baseDir={}", username, baseDir);
        return new LocalFsRemoteStoreSession(baseDir, cdnTemplate);
    }
}
