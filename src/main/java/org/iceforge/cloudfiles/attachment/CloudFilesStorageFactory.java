package org.iceforge.cloudfiles.attachment;

import org.iceforge.cloudfiles.container.ContainerRegistry;
import org.iceforge.cloudfiles.container.StoreConnections;
import org.iceforge.cloudfiles.credentials.CloudFilesCredentials;
import org.iceforge.cloudfiles.credentials.ConfigurationException;
import org.iceforge.cloudfiles.credentials.CredentialResolver;
import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.url.CdnUrlBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Activates {@link CloudFilesAttachmentStorage} for attachments. Shares one
 * {@link StoreConnections} across all of them, so sessions and containers are reused.
 */
public class CloudFilesStorageFactory {
    private static final Logger log = LoggerFactory.getLogger(CloudFilesStorageFactory.class);

    private final CredentialResolver credentialResolver;
    private final StoreConnections connections;

    public CloudFilesStorageFactory(CredentialResolver credentialResolver, StoreConnections connections) {
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Resolves credentials and the container name, gets (or creates and publishes) the container,
     * and returns a backend with an empty queue.
     *
     * @throws ConfigurationException when credentials or the container name are missing or malformed
     * @throws org.iceforge.cloudfiles.store.RemoteServiceException when the store cannot provide the container
     */
    public <T> CloudFilesAttachmentStorage<T> activate(AttachmentContext<T> attachment, CloudFilesOptions<T> options) {
        Object source = options.credentials()
                .orElseThrow(() -> new ConfigurationException("No credentials configured for attachment " + attachment.name()));
        CloudFilesCredentials credentials = credentialResolver.resolve(source);
        String containerName = containerName(attachment, options, credentials);

        ContainerRegistry registry = connections.containers(credentials);
        ContainerHandle container = registry.getOrCreate(containerName);

        log.debug("Activated storage for {} in container {} (environment {})",
                attachment.name(), containerName, credentialResolver.environment());
        return new CloudFilesAttachmentStorage<>(
                attachment,
                credentials,
                container,
                registry.session(),
                new CdnUrlBuilder(credentials.cname()),
                options.ssl(),
                options.pathTemplate());
    }

    /** Option {@code container}, option {@code containerName}, then the credentials' container. */
    static <T> String containerName(AttachmentContext<T> attachment, CloudFilesOptions<T> options,
                                    CloudFilesCredentials credentials) {
        Optional<String> fromOptions = options.container()
                .or(options::containerName)
                .map(source -> source.containerName(attachment));
        return fromOptions
                .filter(name -> !name.isBlank())
                .or(credentials::containerName)
                .orElseThrow(() -> new ConfigurationException(
                        "No container configured for attachment " + attachment.name()
                                + "; set the container option or put container in the credentials"));
    }
}
