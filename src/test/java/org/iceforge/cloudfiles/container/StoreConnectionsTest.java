package org.iceforge.cloudfiles.container;

import org.iceforge.cloudfiles.credentials.CloudFilesCredentials;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class StoreConnectionsTest {

    private RemoteStoreClient client;
    private StoreConnections connections;

    private static CloudFilesCredentials creds(String user, String key) {
        return new CloudFilesCredentials(user, key, false, Optional.empty(), Optional.empty(), Optional.empty());
    }

    @BeforeEach
    void setUp() {
        client = mock(RemoteStoreClient.class);
        when(client.authenticate(anyString(), anyString(), anyBoolean(), any()))
                .thenAnswer(inv -> mock(RemoteStoreSession.class));
        connections = new StoreConnections(client);
    }

    @Test
    void sameAccount_authenticatesOnceAndSharesRegistry() {
        ContainerRegistry first = connections.containers(creds("u", "k"));
        ContainerRegistry second = connections.containers(creds("u", "k"));

        assertSame(first, second);
        assertSame(first.session(), connections.session(creds("u", "k")));
        verify(client, times(1)).authenticate(eq("u"), eq("k"), eq(false), isNull());
    }

    @Test
    void differentAccounts_getSeparateSessions() {
        RemoteStoreSession a = connections.session(creds("a", "k"));
        RemoteStoreSession b = connections.session(creds("b", "k"));

        assertNotSame(a, b);
        verify(client, times(2)).authenticate(anyString(), anyString(), anyBoolean(), any());
    }

    @Test
    void authUrlAndServicenetArePassedThrough() {
        URI auth = URI.create("https://lon.auth.example/v1.0");
        connections.session(new CloudFilesCredentials("u", "k", true, Optional.of(auth), Optional.empty(), Optional.empty()));

        verify(client).authenticate("u", "k", true, auth);
    }

    @Test
    void failedAuthentication_isRetriedOnNextUse() {
        reset(client);
        when(client.authenticate(anyString(), anyString(), anyBoolean(), any()))
                .thenThrow(new RemoteServiceException("401"))
                .thenAnswer(inv -> mock(RemoteStoreSession.class));

        assertThrows(RemoteServiceException.class, () -> connections.session(creds("u", "k")));
        assertNotNull(connections.session(creds("u", "k")));
        verify(client, times(2)).authenticate(anyString(), anyString(), anyBoolean(), any());
    }

    @Test
    void close_closesOpenSessions() {
        RemoteStoreSession session = connections.session(creds("u", "k"));

        connections.close();

        verify(session).close();
    }
}
