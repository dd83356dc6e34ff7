package org.iceforge.cloudfiles.store;

/**
 * Any failure reported by the remote object store: authentication, quota, network or server errors.
 */
public class RemoteServiceException extends RuntimeException {
    public RemoteServiceException(String message, Throwable cause) { super(message, cause); }
    public RemoteServiceException(String message) { super(message); }
}
