package org.iceforge.cloudfiles.store;

public class RemoteObjectNotFoundException extends RemoteServiceException {
    public RemoteObjectNotFoundException(String message, Throwable cause) { super(message, cause); }
    public RemoteObjectNotFoundException(String message) { super(message); }
}
