package org.iceforge.cloudfiles.attachment;

import org.iceforge.cloudfiles.url.SslPolicy;

import java.util.Optional;

/**
 * Per-attachment backend options as declared on the host.
 *
 * <ul>
 *   <li>{@code credentials}: a path, {@link java.io.File}, {@link java.io.InputStream} or
 *       {@link java.util.Map}, see {@link org.iceforge.cloudfiles.credentials.CredentialSource#of(Object)}</li>
 *   <li>{@code container} / {@code containerName}: the container, checked before the name
 *       given in the credentials; created and made public if missing</li>
 *   <li>{@code path}: object path template; the host default is replaced by {@link PathTokens#DEFAULT_PATH}</li>
 *   <li>{@code ssl}: serve URLs over https, constant or per owning record</li>
 * </ul>
 */
public final class CloudFilesOptions<T> {

    private final Object credentials;
    private final ContainerNameSource<T> container;
    private final ContainerNameSource<T> containerName;
    private final String path;
    private final String hostDefaultPath;
    private final SslPolicy<T> ssl;

    private CloudFilesOptions(Builder<T> b) {
        this.credentials = b.credentials;
        this.container = b.container;
        this.containerName = b.containerName;
        this.path = b.path;
        this.hostDefaultPath = b.hostDefaultPath;
        this.ssl = b.ssl;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public Optional<Object> credentials() {
        return Optional.ofNullable(credentials);
    }

    public Optional<ContainerNameSource<T>> container() {
        return Optional.ofNullable(container);
    }

    public Optional<ContainerNameSource<T>> containerName() {
        return Optional.ofNullable(containerName);
    }

    public String pathTemplate() {
        return PathTokens.pathTemplate(path, hostDefaultPath);
    }

    public SslPolicy<T> ssl() {
        return ssl;
    }

    public static final class Builder<T> {
        private Object credentials;
        private ContainerNameSource<T> container;
        private ContainerNameSource<T> containerName;
        private String path;
        private String hostDefaultPath;
        private SslPolicy<T> ssl = SslPolicy.never();

        private Builder() {}

        public Builder<T> credentials(Object credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder<T> container(String container) {
            this.container = container == null ? null : ContainerNameSource.of(container);
            return this;
        }

        public Builder<T> container(ContainerNameSource<T> container) {
            this.container = container;
            return this;
        }

        public Builder<T> containerName(String containerName) {
            this.containerName = containerName == null ? null : ContainerNameSource.of(containerName);
            return this;
        }

        public Builder<T> path(String path) {
            this.path = path;
            return this;
        }

        /** The host framework's own default path, so it can be told apart from an explicit one. */
        public Builder<T> hostDefaultPath(String hostDefaultPath) {
            this.hostDefaultPath = hostDefaultPath;
            return this;
        }

        public Builder<T> ssl(boolean ssl) {
            this.ssl = SslPolicy.of(ssl);
            return this;
        }

        public Builder<T> ssl(SslPolicy<T> ssl) {
            this.ssl = ssl == null ? SslPolicy.never() : ssl;
            return this;
        }

        public CloudFilesOptions<T> build() {
            return new CloudFilesOptions<>(this);
        }
    }
}
