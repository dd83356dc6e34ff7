package org.iceforge.cloudfiles.credentials;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where credentials come from: a YAML file, an open YAML stream, or an already parsed mapping.
 */
public sealed interface CredentialSource
        permits CredentialSource.PathSource, CredentialSource.StreamSource, CredentialSource.InlineSource {

    /** Loads the raw, un-normalized document. */
    Map<?, ?> load();

    /**
     * Adapts a loosely typed host option value. Accepts a {@link String} or {@link Path} path,
     * a {@link File}, an {@link InputStream} or a {@link Map}.
     */
    static CredentialSource of(Object value) {
        if (value instanceof CredentialSource source) return source;
        if (value instanceof Path path) return new PathSource(path);
        if (value instanceof File file) return new PathSource(file.toPath());
        if (value instanceof String path) return new PathSource(Path.of(path));
        if (value instanceof InputStream in) return new StreamSource(in);
        if (value instanceof Map<?, ?> map) return new InlineSource(map);
        throw new ConfigurationException("Credentials are not a path, file, or map: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    record PathSource(Path path) implements CredentialSource {
        public PathSource {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public Map<?, ?> load() {
            if (!Files.isRegularFile(path)) {
                throw new ConfigurationException("Credentials file not found: " + path);
            }
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return asMapping(new Yaml().load(reader), path.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read credentials file " + path, e);
            } catch (YAMLException e) {
                throw new ConfigurationException("Failed to parse credentials YAML at " + path, e);
            }
        }
    }

    /** The stream is read to the end but not closed; the caller owns it. */
    record StreamSource(InputStream in) implements CredentialSource {
        public StreamSource {
            Objects.requireNonNull(in, "in");
        }

        @Override
        public Map<?, ?> load() {
            try {
                return asMapping(new Yaml().load(in), "stream");
            } catch (YAMLException e) {
                throw new ConfigurationException("Failed to parse credentials YAML from stream", e);
            }
        }
    }

    record InlineSource(Map<?, ?> values) implements CredentialSource {
        public InlineSource {
            Objects.requireNonNull(values, "values");
        }

        @Override
        public Map<?, ?> load() {
            return values;
        }
    }

    private static Map<?, ?> asMapping(Object document, String origin) {
        if (document instanceof Map<?, ?> map) return map;
        throw new ConfigurationException("Credentials document at " + origin + " must be a mapping");
    }
}
