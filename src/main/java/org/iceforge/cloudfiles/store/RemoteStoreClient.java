package org.iceforge.cloudfiles.store;

import java.net.URI;

/**
 * Entry point to a remote object store. Implementations are opaque adapters over a vendor client.
 */
public interface RemoteStoreClient {

    /**
     * Opens an authenticated session. Blocking.
     *
     * @param useServiceNet route over the provider's internal network where the provider has one
     * @param authUrl       authentication endpoint, {@code null} for the provider's default
     * @throws RemoteServiceException when the store rejects the credentials or cannot be reached
     */
    RemoteStoreSession authenticate(String username, String apiKey, boolean useServiceNet, URI authUrl);
}
