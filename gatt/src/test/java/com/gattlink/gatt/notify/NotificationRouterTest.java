package com.gattlink.gatt.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NotificationRouter}.
 */
class NotificationRouterTest {

    private static final String DEVICE_A = "AA:BB:CC:11:22:33";
    private static final String DEVICE_B = "11:22:33:44:55:66";

    private final UUID uuid = UUID.fromString("00002a37-0000-1000-8000-00805f9b34fb");
    private final UUID other = UUID.fromString("00002a38-0000-1000-8000-00805f9b34fb");

    private NotificationRouter router;

    @BeforeEach
    void setUp() {
        router = new NotificationRouter();
    }

    @Test
    void route_withoutSubscribersDeliversNothing() {
        assertEquals(0, router.route(DEVICE_A, uuid, new byte[]{1}));
    }

    @Test
    void route_sinkSeesEveryCharacteristicOfItsDevice() {
        List<CharacteristicNotification> received = new ArrayList<>();
        router.setSink(DEVICE_A, received::add);

        router.route(DEVICE_A, uuid, new byte[]{1});
        router.route(DEVICE_A, other, new byte[]{2});
        router.route(DEVICE_B, uuid, new byte[]{3});

        assertEquals(2, received.size());
        assertEquals(uuid, received.get(0).getUuid());
        assertEquals(other, received.get(1).getUuid());
        assertEquals(DEVICE_A, received.get(1).getAddress());
    }

    @Test
    void route_listenersOnlySeeTheirCharacteristic() {
        List<byte[]> values = new ArrayList<>();
        router.addListener(DEVICE_A, uuid, values::add);

        assertEquals(1, router.route(DEVICE_A, uuid, new byte[]{0x0A}));
        assertEquals(0, router.route(DEVICE_A, other, new byte[]{0x0B}));

        assertEquals(1, values.size());
        assertArrayEquals(new byte[]{0x0A}, values.get(0));
    }

    @Test
    void route_failingSubscriberDoesNotBlockOthers() {
        List<byte[]> values = new ArrayList<>();
        router.setSink(DEVICE_A, n -> { throw new IllegalStateException("sink failure"); });
        router.addListener(DEVICE_A, uuid, v -> { throw new RuntimeException("listener failure"); });
        router.addListener(DEVICE_A, uuid, values::add);

        int delivered = assertDoesNotThrow(() -> router.route(DEVICE_A, uuid, new byte[]{1}));

        assertEquals(1, delivered);
        assertEquals(1, values.size());
    }

    @Test
    void route_payloadIsCopiedPerSubscriber() {
        List<byte[]> first = new ArrayList<>();
        List<byte[]> second = new ArrayList<>();
        router.addListener(DEVICE_A, uuid, first::add);
        router.addListener(DEVICE_A, uuid, second::add);
        byte[] payload = {0x01, 0x02};

        router.route(DEVICE_A, uuid, payload);
        payload[0] = 0x7F;
        first.get(0)[1] = 0x7F;

        assertArrayEquals(new byte[]{0x01, 0x02}, second.get(0));
    }

    @Test
    void removeListeners_keepsSinkAndOtherCharacteristics() {
        List<CharacteristicNotification> received = new ArrayList<>();
        router.setSink(DEVICE_A, received::add);
        router.addListener(DEVICE_A, uuid, v -> { });
        router.addListener(DEVICE_A, other, v -> { });

        router.removeListeners(DEVICE_A, uuid);

        assertEquals(0, router.getListenerCount(DEVICE_A, uuid));
        assertEquals(1, router.getListenerCount(DEVICE_A, other));
        assertTrue(router.hasSink(DEVICE_A));
    }

    @Test
    void removeAllListeners_keepsSink() {
        router.setSink(DEVICE_A, n -> { });
        router.addListener(DEVICE_A, uuid, v -> { });

        router.removeAllListeners(DEVICE_A);

        assertEquals(0, router.getListenerCount(DEVICE_A, uuid));
        assertTrue(router.hasSink(DEVICE_A));
    }

    @Test
    void removeDevice_dropsEverything() {
        router.setSink(DEVICE_A, n -> { });
        router.addListener(DEVICE_A, uuid, v -> { });

        router.removeDevice(DEVICE_A);

        assertFalse(router.hasSink(DEVICE_A));
        assertEquals(0, router.route(DEVICE_A, uuid, new byte[]{1}));
    }
}
