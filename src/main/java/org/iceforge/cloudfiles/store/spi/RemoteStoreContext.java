package org.iceforge.cloudfiles.store.spi;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * What a provider needs to build a client, without the library knowing how a given
 * deployment wires networking or endpoints.
 * <br>
 * Providers may interpret {@code tags} any way they want (e.g. "store"="local").
 *
 * @param region           storage region, when the provider has regions
 * @param endpointOverride public endpoint for S3-compatible or private stores
 * @param internalEndpoint endpoint used when credentials ask for the internal service network
 * @param cdnBaseUrl       public prefix objects are served from; {@code {container}} is replaced by the container name
 * @param pathStyleAccess  address containers as a path segment instead of a host name
 * @param localBaseDir     root directory for the local filesystem store
 * @param tags             arbitrary selectors
 * @param apiTimeout       per-call timeout applied by the client, none when absent
 */
public record RemoteStoreContext(
        Optional<String> region,
        Optional<URI> endpointOverride,
        Optional<URI> internalEndpoint,
        Optional<String> cdnBaseUrl,
        boolean pathStyleAccess,
        Optional<Path> localBaseDir,
        Map<String, String> tags,
        Optional<Duration> apiTimeout
) {

    public static RemoteStoreContext empty() {
        return new RemoteStoreContext(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                false, Optional.empty(), Map.of(), Optional.empty());
    }

    /** Non-secret summary for logs. */
    public String describe() {
        return "region=" + region.orElse("<default>")
                + ", endpointOverride=" + endpointOverride.map(Object::toString).orElse("<none>")
                + ", internalEndpoint=" + internalEndpoint.map(Object::toString).orElse("<none>")
                + ", cdnBaseUrl=" + cdnBaseUrl.orElse("<none>")
                + ", localBaseDir=" + localBaseDir.map(Object::toString).orElse("<none>")
                + ", tags=" + tags;
    }
}
