package org.iceforge.cloudfiles.store;

/**
 * A store client library or provider required by the configuration is not on the classpath.
 */
public class DependencyUnavailableException extends RuntimeException {
    public DependencyUnavailableException(String message, Throwable cause) { super(message, cause); }
    public DependencyUnavailableException(String message) { super(message); }
}
