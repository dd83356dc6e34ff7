package org.iceforge.cloudfiles.url;

import org.iceforge.cloudfiles.store.ContainerHandle;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Public URLs for stored objects: {@code <cdnBase>/<percentEncodedObjectPath>}.
 * <p>
 * A configured CNAME replaces the container's CDN base for both plain and SSL URLs. It is used
 * as given except for trailing slashes, which are dropped like those of the CDN bases.
 */
public final class CdnUrlBuilder {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /** Characters left as-is by {@link #percentEncode(String)}: unreserved and reserved URL characters. */
    private static final BitSet SAFE = new BitSet(128);

    static {
        for (char c = 'a'; c <= 'z'; c++) SAFE.set(c);
        for (char c = 'A'; c <= 'Z'; c++) SAFE.set(c);
        for (char c = '0'; c <= '9'; c++) SAFE.set(c);
        for (char c : "-_.!~*'();/?:@&=+$,[]".toCharArray()) SAFE.set(c);
    }

    private final Optional<String> cname;

    public CdnUrlBuilder(Optional<String> cname) {
        this.cname = Objects.requireNonNull(cname, "cname").map(CdnUrlBuilder::trimTrailingSlash);
    }

    public String buildBaseUrl(ContainerHandle container, boolean useSsl) {
        if (cname.isPresent()) return cname.get();

        String base = useSsl ? container.cdnSslUrl() : container.cdnUrl();
        if (base == null || base.isBlank()) {
            throw new IllegalStateException("Container " + container.name() + " has no "
                    + (useSsl ? "SSL " : "") + "CDN URL; is it public?");
        }
        return trimTrailingSlash(base);
    }

    public String objectUrl(String baseUrl, String objectPath) {
        return baseUrl + "/" + percentEncode(objectPath);
    }

    public String objectUrl(ContainerHandle container, boolean useSsl, String objectPath) {
        return objectUrl(buildBaseUrl(container, useSsl), objectPath);
    }

    /**
     * Escapes everything outside the unreserved and reserved URL characters as UTF-8 {@code %XX},
     * then escapes {@code &} as {@code %26} so object names containing it survive query parsing.
     */
    public static String percentEncode(String path) {
        byte[] bytes = path.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length + 8);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c == '&') {
                sb.append("%26");
            } else if (c < 128 && SAFE.get(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static String trimTrailingSlash(String s) {
        String out = s;
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }
}
