package org.iceforge.cloudfiles.credentials;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical key form for credential documents.
 * <p>
 * {@code apiKey}, {@code API-KEY}, {@code :api_key} and {@code api_key} all map to {@code api_key}.
 */
public final class CredentialKeys {

    public static final String USERNAME = "username";
    public static final String API_KEY = "api_key";
    public static final String SERVICENET = "servicenet";
    public static final String AUTH_URL = "auth_url";
    public static final String CONTAINER = "container";
    public static final String CONTAINER_NAME = "container_name";
    public static final String CNAME = "cname";

    private CredentialKeys() {}

    public static String normalize(Object key) {
        if (key == null) {
            throw new ConfigurationException("Credential document contains a null key");
        }
        String s = key.toString().trim();
        if (s.startsWith(":")) s = s.substring(1);

        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '-' || c == ' ') {
                sb.append('_');
            } else if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(s.charAt(i - 1))) {
                sb.append('_').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /** Copies {@code raw} with every top-level key normalized; nested values are kept as-is. */
    public static Map<String, Object> normalizeKeys(Map<?, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            out.put(normalize(e.getKey()), e.getValue());
        }
        return out;
    }
}
