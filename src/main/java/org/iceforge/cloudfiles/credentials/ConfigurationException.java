package org.iceforge.cloudfiles.credentials;

/**
 * Raised when a credential source or a backend option is missing or malformed.
 * Always surfaced at activation time.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
    public ConfigurationException(String message) { super(message); }
}
