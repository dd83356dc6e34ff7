package org.iceforge.cloudfiles.store;

import java.util.Objects;

/**
 * A remote container and the CDN prefixes its objects are served from.
 *
 * @param name         container name
 * @param cdnUrl       plain HTTP CDN base, no trailing slash
 * @param cdnSslUrl    HTTPS CDN base, no trailing slash
 * @param publicAccess whether anonymous reads through the CDN are allowed
 */
public record ContainerHandle(String name, String cdnUrl, String cdnSslUrl, boolean publicAccess) {

    public ContainerHandle {
        Objects.requireNonNull(name, "name");
    }

    public ContainerHandle published(String cdnUrl, String cdnSslUrl) {
        return new ContainerHandle(name, cdnUrl, cdnSslUrl, true);
    }
}
