package com.gattlink.gatt.session;

import com.gattlink.gatt.error.GattErrorCode;
import com.gattlink.gatt.error.GattException;
import com.gattlink.gatt.event.LifecycleEventNotifier;
import com.gattlink.gatt.notify.NotificationRouter;
import com.gattlink.gatt.testing.SimulatedConnection;
import com.gattlink.gatt.testing.SimulatedGattStack;
import com.gattlink.gatt.testing.SimulatedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionRegistry}.
 */
class SessionRegistryTest {

    private static final String ADDRESS = "AA:BB:CC:11:22:33";

    private SimulatedGattStack stack;
    private AtomicInteger created;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        stack = new SimulatedGattStack();
        created = new AtomicInteger();
        NotificationRouter router = new NotificationRouter();
        LifecycleEventNotifier notifier = new LifecycleEventNotifier();
        registry = new SessionRegistry("test", address -> {
            created.incrementAndGet();
            return new GattSession(address, stack, router, notifier, DescriptorSlotPolicy.PER_CHARACTERISTIC);
        });
    }

    @Test
    void openSession_unknownAddressFailsNotFound() {
        GattException e = assertThrows(GattException.class, () -> registry.openSession(ADDRESS));

        assertEquals(GattErrorCode.NOT_FOUND, e.getErrorCode());
        assertEquals(0, created.get());
    }

    @Test
    void openSession_createsOnceAndReuses() throws Exception {
        assertTrue(registry.registerDevice(ADDRESS));
        assertFalse(registry.registerDevice(ADDRESS));

        GattSession first = registry.openSession(ADDRESS);
        GattSession second = registry.openSession(ADDRESS);

        assertSame(first, second);
        assertEquals(1, created.get());
        assertEquals(1, registry.getTotalSessionCount());
        assertSame(first, registry.getSession(ADDRESS).orElseThrow());
    }

    @Test
    void getSession_absentUntilOpened() {
        registry.registerDevice(ADDRESS);

        assertTrue(registry.getSession(ADDRESS).isEmpty());
        assertTrue(registry.isKnown(ADDRESS));
        assertEquals(Set.of(ADDRESS), registry.getKnownDevices());
    }

    @Test
    void connectedSessionsReflectSessionState() throws Exception {
        registry.registerDevice(ADDRESS);
        registry.registerDevice("11:22:33:44:55:66");
        GattSession session = registry.openSession(ADDRESS);
        registry.openSession("11:22:33:44:55:66");

        session.connect(null);
        stack.lastConnection(ADDRESS).acceptConnection();

        assertEquals(List.of(session), registry.getConnectedSessions());
        assertEquals(1, registry.getConnectedSessionCount());
        assertEquals(2, registry.getTotalSessionCount());
    }

    @Test
    void removeSession_disconnectsSession() throws Exception {
        registry.registerDevice(ADDRESS);
        GattSession session = registry.openSession(ADDRESS);
        session.connect(null);
        SimulatedConnection connection = stack.lastConnection(ADDRESS);
        connection.acceptConnection();

        assertSame(session, registry.removeSession(ADDRESS));

        assertFalse(session.isConnected());
        assertEquals(1, connection.getRequests(SimulatedRequest.Type.DISCONNECT).size());
        assertTrue(registry.getSession(ADDRESS).isEmpty());
        assertTrue(registry.isKnown(ADDRESS), "Removing a session keeps the device known");
        assertNull(registry.removeSession(ADDRESS));
    }

    @Test
    void forgetDevice_dropsAddressAndSession() throws Exception {
        registry.registerDevice(ADDRESS);
        registry.openSession(ADDRESS);

        assertTrue(registry.forgetDevice(ADDRESS));

        assertFalse(registry.isKnown(ADDRESS));
        assertEquals(0, registry.getTotalSessionCount());
        assertThrows(GattException.class, () -> registry.openSession(ADDRESS));
        assertFalse(registry.forgetDevice(ADDRESS));
    }

    @Test
    void clear_disconnectsEverySessionButKeepsDevices() throws Exception {
        registry.registerDevice(ADDRESS);
        registry.registerDevice("11:22:33:44:55:66");
        registry.openSession(ADDRESS);
        registry.openSession("11:22:33:44:55:66");

        registry.clear();

        assertEquals(0, registry.getTotalSessionCount());
        assertEquals(2, registry.getKnownDeviceCount());
    }

    @Test
    void concurrentOpenSessionCreatesSingleSession() throws Exception {
        registry.registerDevice(ADDRESS);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Set<GattSession> seen = ConcurrentHashMap.newKeySet();
        List<Thread> workers = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                    seen.add(registry.openSession(ADDRESS));
                } catch (Exception e) {
                    fail(e);
                } finally {
                    done.countDown();
                }
            });
            workers.add(worker);
            worker.start();
        }

        start.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, seen.size());
        assertEquals(1, created.get());
    }

    @Test
    void removedSessionRefusesToConnect() throws Exception {
        registry.registerDevice(ADDRESS);
        GattSession session = registry.openSession(ADDRESS);

        registry.removeSession(ADDRESS);
        CompletableFuture<Void> connected = session.connect(null);

        assertTrue(session.isRetired());
        ExecutionException e = assertThrows(ExecutionException.class, connected::get);
        assertEquals(GattErrorCode.NOT_FOUND, GattException.unwrap(e).getErrorCode());
        assertEquals(0, stack.getConnectAttempts());
    }

    @Test
    void forgetDeviceRacingConnectLeavesNoUntrackedLink() throws Exception {
        for (int round = 0; round < 1000; round++) {
            registry.registerDevice(ADDRESS);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(2);
            List<GattSession> opened = new CopyOnWriteArrayList<>();

            Thread connector = new Thread(() -> {
                try {
                    start.await();
                    GattSession session = registry.openSession(ADDRESS);
                    opened.add(session);
                    session.connect(null);
                } catch (GattException e) {
                    assertEquals(GattErrorCode.NOT_FOUND, e.getErrorCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            Thread forgetter = new Thread(() -> {
                try {
                    start.await();
                    registry.forgetDevice(ADDRESS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            connector.start();
            forgetter.start();
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));

            if (stack.getConnectAttempts() > 0) {
                stack.lastConnection(ADDRESS).acceptConnection();
            }
            for (GattSession session : opened) {
                if (session.isConnected()) {
                    assertSame(session, registry.getSession(ADDRESS).orElse(null),
                            "Connected session must stay reachable, round " + round);
                }
            }
            registry.forgetDevice(ADDRESS);
        }
    }
}
