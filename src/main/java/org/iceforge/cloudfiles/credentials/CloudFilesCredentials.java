package org.iceforge.cloudfiles.credentials;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved account credentials for one backend activation.
 *
 * @param username      account user name
 * @param apiKey        API key paired with {@code username}
 * @param servicenet    route traffic over the provider's internal network when supported
 * @param authUrl       authentication endpoint, the store provider's default when absent
 * @param containerName container to store objects in, when configured alongside the account
 * @param cname         CDN host override used verbatim for public URLs
 */
public record CloudFilesCredentials(
        String username,
        String apiKey,
        boolean servicenet,
        Optional<URI> authUrl,
        Optional<String> containerName,
        Optional<String> cname
) {

    public CloudFilesCredentials {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(apiKey, "apiKey");
        authUrl = authUrl == null ? Optional.empty() : authUrl;
        containerName = containerName == null ? Optional.empty() : containerName;
        cname = cname == null ? Optional.empty() : cname;
    }

    /** Never print the API key. */
    @Override
    public String toString() {
        return "CloudFilesCredentials[username=" + username
                + ", servicenet=" + servicenet
                + ", authUrl=" + authUrl.map(URI::toString).orElse("<default>")
                + ", containerName=" + containerName.orElse("<none>")
                + ", cname=" + cname.orElse("<none>") + "]";
    }
}
