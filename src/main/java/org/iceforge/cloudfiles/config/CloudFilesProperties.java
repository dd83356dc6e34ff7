package org.iceforge.cloudfiles.config;

import org.iceforge.cloudfiles.store.spi.RemoteStoreContext;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide settings for the Cloud Files attachment backend. Account credentials are not
 * here; they come from each attachment's credentials option.
 */
@ConfigurationProperties(prefix = "cloudfiles")
public class CloudFilesProperties {

    /**
     * Optional explicit provider id ("s3", "local"). If set, only that provider is used (or startup fails).
     */
    private String provider;

    /** Environment name used to pick a section of environment-scoped credential files. Defaults to the first active profile. */
    private String environment;

    private String region;
    private URI endpointOverride;

    /** Endpoint used for accounts with {@code servicenet: true}. */
    private URI internalEndpoint;

    /** Public prefix for objects, {@code {container}} is replaced by the container name. */
    private String cdnBaseUrl;

    private boolean pathStyleAccess;

    /** Root directory of the local store. */
    private Path localBaseDir;

    private Duration apiTimeout;

    /** Arbitrary selector tags passed to providers. */
    private Map<String, String> tags = new HashMap<>();

    public RemoteStoreContext toContext() {
        return new RemoteStoreContext(
                Optional.ofNullable(blankToNull(region)),
                Optional.ofNullable(endpointOverride),
                Optional.ofNullable(internalEndpoint),
                Optional.ofNullable(blankToNull(cdnBaseUrl)),
                pathStyleAccess,
                Optional.ofNullable(localBaseDir),
                tags == null ? Map.of() : Map.copyOf(tags),
                Optional.ofNullable(apiTimeout));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public URI getEndpointOverride() { return endpointOverride; }
    public void setEndpointOverride(URI endpointOverride) { this.endpointOverride = endpointOverride; }

    public URI getInternalEndpoint() { return internalEndpoint; }
    public void setInternalEndpoint(URI internalEndpoint) { this.internalEndpoint = internalEndpoint; }

    public String getCdnBaseUrl() { return cdnBaseUrl; }
    public void setCdnBaseUrl(String cdnBaseUrl) { this.cdnBaseUrl = cdnBaseUrl; }

    public boolean isPathStyleAccess() { return pathStyleAccess; }
    public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

    public Path getLocalBaseDir() { return localBaseDir; }
    public void setLocalBaseDir(Path localBaseDir) { this.localBaseDir = localBaseDir; }

    public Duration getApiTimeout() { return apiTimeout; }
    public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }

    public Map<String, String> getTags() { return tags; }
    public void setTags(Map<String, String> tags) { this.tags = tags; }
}
