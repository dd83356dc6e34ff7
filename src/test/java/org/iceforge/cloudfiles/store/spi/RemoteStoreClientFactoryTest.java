package org.iceforge.cloudfiles.store.spi;

import org.iceforge.cloudfiles.store.DependencyUnavailableException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RemoteStoreClientFactoryTest {

    RemoteStoreProvider providerA;
    RemoteStoreProvider providerB;
    RemoteStoreClientFactory factory;

    @BeforeEach
    void setUp() {
        providerA = mock(RemoteStoreProvider.class);
        when(providerA.id()).thenReturn("providerA");
        when(providerA.supports(any())).thenReturn(true);
        when(providerA.client(any())).thenReturn(mock(RemoteStoreClient.class));

        providerB = mock(RemoteStoreProvider.class);
        when(providerB.id()).thenReturn("providerB");
        when(providerB.supports(any())).thenReturn(true);
        when(providerB.client(any())).thenReturn(mock(RemoteStoreClient.class));

        factory = new RemoteStoreClientFactory(List.of(providerA, providerB), false);
    }

    @Test
    void forcedProviderIsUsed() {
        RemoteStoreClientFactory.ResolvedStore resolved = factory.resolve("providerB", RemoteStoreContext.empty());

        assertEquals("providerB", resolved.providerId());
        verify(providerB, times(1)).client(any(RemoteStoreContext.class));
        verify(providerA, never()).client(any());
    }

    @Test
    void unknownForcedProviderFailsFastWithHint() {
        DependencyUnavailableException ex = assertThrows(DependencyUnavailableException.class,
                () -> factory.resolve("swift", RemoteStoreContext.empty()));

        assertTrue(ex.getMessage().contains("'swift' not found"));
        assertTrue(ex.getMessage().contains("providerA"));
    }

    @Test
    void picksLexicographicallyWhenMultipleSupport() {
        RemoteStoreClientFactory.ResolvedStore resolved = factory.resolve(null, RemoteStoreContext.empty());

        assertEquals("providerA", resolved.providerId());
        verify(providerB, never()).client(any());
    }

    @Test
    void throwsWhenNoProvidersSupport() {
        RemoteStoreProvider rejecting = mock(RemoteStoreProvider.class);
        when(rejecting.id()).thenReturn("rejecting");
        when(rejecting.supports(any())).thenReturn(false);

        RemoteStoreClientFactory localFactory = new RemoteStoreClientFactory(List.of(rejecting), false);

        DependencyUnavailableException ex = assertThrows(DependencyUnavailableException.class,
                () -> localFactory.resolve(" ", RemoteStoreContext.empty()));
        assertTrue(ex.getMessage().contains("No RemoteStoreProvider supports"));
    }

    @Test
    void serviceLoaderDiscoversBundledProviders() {
        RemoteStoreClientFactory discovering = new RemoteStoreClientFactory(List.of());

        assertEquals(List.of("local", "s3"), discovering.ids());
    }

    @Test
    void springProviderOverridesServiceLoaderProviderWithSameId() {
        RemoteStoreProvider customS3 = mock(RemoteStoreProvider.class);
        when(customS3.id()).thenReturn("s3");
        RemoteStoreClient custom = mock(RemoteStoreClient.class);
        when(customS3.client(any())).thenReturn(custom);

        RemoteStoreClientFactory merged = new RemoteStoreClientFactory(List.of(customS3));

        assertSame(custom, merged.resolve("s3", RemoteStoreContext.empty()).client());
    }
}
