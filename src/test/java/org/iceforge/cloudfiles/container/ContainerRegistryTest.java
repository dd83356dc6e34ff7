package org.iceforge.cloudfiles.container;

import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ContainerRegistryTest {

    @Mock
    private RemoteStoreSession session;

    private ContainerRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(session.createContainer(anyString()))
                .thenAnswer(inv -> new ContainerHandle(inv.getArgument(0), null, null, false));
        when(session.makePublic(any(ContainerHandle.class)))
                .thenAnswer(inv -> {
                    ContainerHandle c = inv.getArgument(0);
                    return c.published("http://cdn.example/" + c.name(), "https://ssl.example/" + c.name());
                });
        registry = new ContainerRegistry(session);
    }

    @Test
    void getOrCreate_twice_createsOnceAndReturnsSameHandle() {
        ContainerHandle first = registry.getOrCreate("avatars");
        ContainerHandle second = registry.getOrCreate("avatars");

        assertSame(first, second);
        verify(session, times(1)).createContainer("avatars");
        verify(session, times(1)).makePublic(any(ContainerHandle.class));
    }

    @Test
    void getOrCreate_marksContainerPublicBeforeReturning() {
        ContainerHandle c = registry.getOrCreate("avatars");

        assertTrue(c.publicAccess());
        assertEquals("http://cdn.example/avatars", c.cdnUrl());
        assertEquals("https://ssl.example/avatars", c.cdnSslUrl());
        var order = inOrder(session);
        order.verify(session).createContainer("avatars");
        order.verify(session).makePublic(any(ContainerHandle.class));
    }

    @Test
    void getOrCreate_distinctNamesAreIndependent() {
        registry.getOrCreate("a");
        registry.getOrCreate("b");

        verify(session).createContainer("a");
        verify(session).createContainer("b");
        assertTrue(registry.cached("a").isPresent());
        assertTrue(registry.cached("b").isPresent());
    }

    @Test
    void getOrCreate_failureIsNotCachedAndNotRetried() {
        when(session.createContainer("broken")).thenThrow(new RemoteServiceException("quota exceeded"));

        assertThrows(RemoteServiceException.class, () -> registry.getOrCreate("broken"));
        verify(session, times(1)).createContainer("broken");
        assertTrue(registry.cached("broken").isEmpty());

        assertThrows(RemoteServiceException.class, () -> registry.getOrCreate("broken"));
        verify(session, times(2)).createContainer("broken");
    }

    @Test
    void getOrCreate_publishFailurePropagates() {
        when(session.makePublic(any(ContainerHandle.class))).thenThrow(new RemoteServiceException("acl denied"));

        RemoteServiceException ex = assertThrows(RemoteServiceException.class, () -> registry.getOrCreate("x"));
        assertEquals("acl denied", ex.getMessage());
        assertTrue(registry.cached("x").isEmpty());
    }

    @Test
    void getOrCreate_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate(" "));
        verifyNoInteractions(session);
    }

    @Test
    void evict_forcesRecreation() {
        registry.getOrCreate("avatars");
        registry.evict("avatars");
        registry.getOrCreate("avatars");

        verify(session, times(2)).createContainer("avatars");
    }

    @Test
    void concurrentGetOrCreate_createsExactlyOnce() throws Exception {
        AtomicInteger creates = new AtomicInteger();
        CountDownLatch insideCreate = new CountDownLatch(1);
        reset(session);
        when(session.createContainer("x")).thenAnswer(inv -> {
            creates.incrementAndGet();
            insideCreate.countDown();
            // Hold the creation open so the other callers pile up behind the lock.
            Thread.sleep(100);
            return new ContainerHandle("x", null, null, false);
        });
        when(session.makePublic(any(ContainerHandle.class)))
                .thenAnswer(inv -> ((ContainerHandle) inv.getArgument(0)).published("http://cdn/x", "https://cdn/x"));

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ContainerHandle>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<ContainerHandle> task = () -> {
                    start.await();
                    return registry.getOrCreate("x");
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            assertTrue(insideCreate.await(5, TimeUnit.SECONDS));

            Set<ContainerHandle> handles = new HashSet<>();
            for (Future<ContainerHandle> f : futures) {
                handles.add(f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, creates.get());
            assertEquals(1, handles.size());
            verify(session, times(1)).makePublic(any(ContainerHandle.class));
        } finally {
            pool.shutdownNow();
        }
    }
}
