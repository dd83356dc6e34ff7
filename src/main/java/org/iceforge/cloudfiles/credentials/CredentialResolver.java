package org.iceforge.cloudfiles.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link CredentialSource} into {@link CloudFilesCredentials}.
 * <p>
 * Documents may be environment-scoped, the same way a database config file is:
 * <pre>
 * development:
 *   username: hayley
 *   api_key: a7f...
 * production:
 *   username: minter
 *   api_key: 87k...
 *   servicenet: true
 *   cname: http://cdn.myapp.com
 * </pre>
 * When the document has a mapping under the current environment name that mapping is used,
 * otherwise the whole document is treated as one flat credential set. Section keys and the
 * environment name are compared in {@link CredentialKeys#normalize normalized} form, so a
 * {@code prod-eu} profile finds a {@code prod-eu:} or {@code prodEu:} section.
 * <p>
 * Nothing is cached here; each backend activation resolves once and keeps the result.
 */
public class CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final String environment;

    public CredentialResolver(String environment) {
        Objects.requireNonNull(environment, "environment");
        this.environment = environment.trim();
    }

    public String environment() {
        return environment;
    }

    public CloudFilesCredentials resolve(CredentialSource source) {
        Objects.requireNonNull(source, "source");
        Map<String, Object> document = CredentialKeys.normalizeKeys(source.load());
        Map<String, Object> effective = selectEnvironment(document);
        return toCredentials(effective);
    }

    /** Convenience for loosely typed host options, see {@link CredentialSource#of(Object)}. */
    public CloudFilesCredentials resolve(Object source) {
        return resolve(CredentialSource.of(source));
    }

    private Map<String, Object> selectEnvironment(Map<String, Object> document) {
        Object scoped = document.get(CredentialKeys.normalize(environment));
        if (scoped instanceof Map<?, ?> section) {
            log.debug("Using credentials section for environment '{}'", environment);
            return CredentialKeys.normalizeKeys(section);
        }
        return document;
    }

    private CloudFilesCredentials toCredentials(Map<String, Object> values) {
        String username = requiredString(values, CredentialKeys.USERNAME);
        String apiKey = requiredString(values, CredentialKeys.API_KEY);
        boolean servicenet = bool(values.get(CredentialKeys.SERVICENET));
        Optional<URI> authUrl = optionalString(values, CredentialKeys.AUTH_URL).map(v -> uri(CredentialKeys.AUTH_URL, v));

        Optional<String> container = optionalString(values, CredentialKeys.CONTAINER)
                .or(() -> optionalString(values, CredentialKeys.CONTAINER_NAME));
        Optional<String> cname = optionalString(values, CredentialKeys.CNAME);
        cname.ifPresent(v -> uri(CredentialKeys.CNAME, v));

        return new CloudFilesCredentials(username, apiKey, servicenet, authUrl, container, cname);
    }

    private static String requiredString(Map<String, Object> values, String key) {
        return optionalString(values, key)
                .orElseThrow(() -> new ConfigurationException("Credentials are missing required key '" + key + "'"));
    }

    private static Optional<String> optionalString(Map<String, Object> values, String key) {
        Object v = values.get(key);
        if (v == null) return Optional.empty();
        if (v instanceof Map<?, ?> || v instanceof Iterable<?>) {
            throw new ConfigurationException("Credential key '" + key + "' must be a scalar value");
        }
        String s = v.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    private static boolean bool(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0", "" -> false;
            default -> throw new ConfigurationException("Credential key 'servicenet' is not a boolean: " + v);
        };
    }

    private static URI uri(String key, String value) {
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Credential key '" + key + "' is not a valid URL: " + value, e);
        }
    }
}
