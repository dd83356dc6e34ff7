package org.iceforge.cloudfiles.attachment;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Path template defaults and the interpolation token this backend contributes to the host.
 */
public final class PathTokens {

    /** Object path used when the host is left on its own default path. */
    public static final String DEFAULT_PATH = ":attachment/:id/:style/:basename.:extension";

    /** Expands to the object path of the style being interpolated. */
    public static final String CF_PATH_FILENAME = ":cf_path_filename";

    private PathTokens() {}

    /** Hook the host exposes for registering interpolation tokens. */
    @FunctionalInterface
    public interface TokenRegistrar {
        void register(String token, BiFunction<AttachmentContext<?>, String, String> resolver);
    }

    public static void register(TokenRegistrar registrar) {
        registrar.register(CF_PATH_FILENAME, PathTokens::resolve);
    }

    public static String resolve(AttachmentContext<?> attachment, String style) {
        return attachment.path(style);
    }

    /**
     * The host's default path is replaced by {@link #DEFAULT_PATH}; any explicitly configured
     * path is kept.
     */
    public static String pathTemplate(String configuredPath, String hostDefaultPath) {
        if (configuredPath == null || configuredPath.isBlank() || Objects.equals(configuredPath, hostDefaultPath)) {
            return DEFAULT_PATH;
        }
        return configuredPath;
    }
}
