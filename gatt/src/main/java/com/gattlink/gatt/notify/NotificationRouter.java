package com.gattlink.gatt.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Demultiplexes inbound characteristic-change events to their subscribers.
 *
 * <p>Each device may have one {@link NotificationSink}, which sees every notification of
 * that device, and any number of {@link CharacteristicListener}s keyed by characteristic
 * uuid. A subscriber that throws is logged and does not prevent delivery to the others.</p>
 *
 * <p>Thread Safety: registration and routing may run concurrently. Listener lists are
 * copy-on-write, so a route in progress sees a consistent snapshot.</p>
 */
public class NotificationRouter {

    private static final Logger log = LoggerFactory.getLogger(NotificationRouter.class);

    private final Map<String, NotificationSink> sinks = new ConcurrentHashMap<>();
    private final Map<String, Map<UUID, List<CharacteristicListener>>> listeners = new ConcurrentHashMap<>();

    // ========== Sinks ==========

    /**
     * Register the sink for a device, replacing any previous one.
     */
    public void setSink(String address, NotificationSink sink) {
        sinks.put(address, sink);
        log.debug("[{}] Notification sink registered", address);
    }

    public void clearSink(String address) {
        sinks.remove(address);
    }

    public boolean hasSink(String address) {
        return sinks.containsKey(address);
    }

    // ========== Listeners ==========

    public void addListener(String address, UUID uuid, CharacteristicListener listener) {
        listeners.computeIfAbsent(address, a -> new ConcurrentHashMap<>())
                .computeIfAbsent(uuid, u -> new CopyOnWriteArrayList<>())
                .add(listener);
        log.debug("[{}] Listener added for {}", address, uuid);
    }

    /**
     * Remove every listener of one characteristic.
     */
    public void removeListeners(String address, UUID uuid) {
        Map<UUID, List<CharacteristicListener>> byUuid = listeners.get(address);
        if (byUuid != null) {
            byUuid.remove(uuid);
        }
    }

    /**
     * Remove every listener of a device. The sink stays registered.
     */
    public void removeAllListeners(String address) {
        listeners.remove(address);
    }

    public int getListenerCount(String address, UUID uuid) {
        Map<UUID, List<CharacteristicListener>> byUuid = listeners.get(address);
        if (byUuid == null) {
            return 0;
        }
        List<CharacteristicListener> list = byUuid.get(uuid);
        return list != null ? list.size() : 0;
    }

    /**
     * Forget everything registered for a device.
     */
    public void removeDevice(String address) {
        sinks.remove(address);
        listeners.remove(address);
    }

    // ========== Routing ==========

    /**
     * Deliver a notification to the device sink and to the listeners of its uuid.
     *
     * @return the number of subscribers that received the value
     */
    public int route(String address, UUID uuid, byte[] payload) {
        CharacteristicNotification notification = new CharacteristicNotification(address, uuid, payload);
        int delivered = 0;

        NotificationSink sink = sinks.get(address);
        if (sink != null) {
            try {
                sink.onNotification(notification);
                delivered++;
            } catch (Exception e) {
                log.error("[{}] Notification sink failed for {}", address, uuid, e);
            }
        }

        Map<UUID, List<CharacteristicListener>> byUuid = listeners.get(address);
        List<CharacteristicListener> uuidListeners = byUuid != null ? byUuid.get(uuid) : null;
        if (uuidListeners != null) {
            for (CharacteristicListener listener : uuidListeners) {
                try {
                    listener.onValue(notification.getPayload());
                    delivered++;
                } catch (Exception e) {
                    log.error("[{}] Characteristic listener failed for {}", address, uuid, e);
                }
            }
        }

        if (delivered == 0) {
            log.debug("[{}] No subscriber for notification on {}", address, uuid);
        }
        return delivered;
    }
}
