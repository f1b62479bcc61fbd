package com.gattlink.gatt.session;

import com.gattlink.gatt.error.GattErrorCode;
import com.gattlink.gatt.error.GattException;
import com.gattlink.gatt.event.LifecycleEventNotifier;
import com.gattlink.gatt.model.GattCharacteristicInfo;
import com.gattlink.gatt.model.GattConstants;
import com.gattlink.gatt.model.GattServiceInfo;
import com.gattlink.gatt.notify.CharacteristicListener;
import com.gattlink.gatt.notify.NotificationRouter;
import com.gattlink.gatt.stack.GattConnection;
import com.gattlink.gatt.stack.GattStack;
import com.gattlink.gatt.stack.GattStackCallback;
import com.gattlink.gatt.stack.NativeCharacteristic;
import com.gattlink.gatt.stack.NativeService;
import com.gattlink.gatt.stack.WriteType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One GATT connection to a remote peripheral.
 *
 * <p>The session owns the connection state machine, the characteristic index built by
 * service discovery, and the tables correlating native callbacks with the futures handed
 * out to callers. It is itself the {@link GattStackCallback} of its connection.</p>
 *
 * <p>Thread Safety:</p>
 * <ul>
 *   <li>All mutable state is guarded by a single {@link ReentrantLock}</li>
 *   <li>Native requests are issued while the lock is held, so a pending entry is always
 *       recorded before its callback can be processed</li>
 *   <li>Futures, lifecycle events and the disconnect callback run after the lock is
 *       released</li>
 *   <li>Callbacks from a handle that is no longer current are ignored</li>
 *   <li>Once {@link #retire() retired} the session refuses to connect</li>
 * </ul>
 *
 * <p>At most one read and one write may be outstanding per characteristic. A second
 * request for the same characteristic fails the first with
 * {@link GattErrorCode#OPERATION_OVERWRITTEN}; there is no queuing.</p>
 */
public class GattSession implements GattStackCallback {

    private static final Logger log = LoggerFactory.getLogger(GattSession.class);

    /** Descriptor table key used by {@link DescriptorSlotPolicy#SHARED}. */
    static final UUID SHARED_DESCRIPTOR_SLOT = new UUID(0L, 0L);

    private final String address;
    private final GattStack stack;
    private final NotificationRouter router;
    private final LifecycleEventNotifier notifier;
    private final DescriptorSlotPolicy descriptorSlotPolicy;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private GattConnection connection;
    private GattConnection connecting;
    private CompletableFuture<Void> pendingConnect;
    private Runnable onDisconnect;
    private boolean retired;
    private List<GattServiceInfo> services = List.of();
    private final Map<UUID, NativeCharacteristic> characteristicIndex = new LinkedHashMap<>();
    private CompletableFuture<List<GattServiceInfo>> pendingDiscovery;
    private final PendingOperationTable<UUID, byte[]> pendingReads = new PendingOperationTable<>();
    private final PendingOperationTable<UUID, Void> pendingWrites = new PendingOperationTable<>();
    private final PendingOperationTable<UUID, Void> pendingDescriptorOps = new PendingOperationTable<>();
    private final Map<CompletableFuture<Void>, PendingListener> pendingListeners = new HashMap<>();
    private CompletableFuture<Integer> pendingMtu;
    private int mtu = GattConstants.DEFAULT_MTU;

    // Metrics (null until bound)
    private MeterRegistry meterRegistry;
    private final List<Meter> meters = new ArrayList<>();
    private Counter operationsCounter;
    private Counter failuresCounter;
    private Counter overwrittenCounter;
    private Counter notificationsCounter;
    private Counter connectCounter;
    private Counter connectFailedCounter;
    private Counter disconnectCounter;

    public GattSession(String address, GattStack stack, NotificationRouter router,
                       LifecycleEventNotifier notifier, DescriptorSlotPolicy descriptorSlotPolicy) {
        this.address = Objects.requireNonNull(address, "address");
        this.stack = Objects.requireNonNull(stack, "stack");
        this.router = Objects.requireNonNull(router, "router");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.descriptorSlotPolicy = Objects.requireNonNull(descriptorSlotPolicy, "descriptorSlotPolicy");
    }

    // =====================================================
    // Metrics Binding
    // =====================================================

    /**
     * Bind Micrometer metrics for this session.
     *
     * @param registry   the meter registry (null to disable metrics)
     * @param clientName name of the owning client, used as a tag
     */
    public void bindMetrics(MeterRegistry registry, String clientName) {
        if (registry == null) {
            return;
        }

        Tags tags = Tags.of("address", address, "client", clientName);
        meterRegistry = registry;

        meters.add(Gauge.builder("gattlink.session.state", this, s -> s.state.ordinal())
                .tags(tags).description("Connection state ordinal").register(registry));
        meters.add(Gauge.builder("gattlink.session.mtu", this, GattSession::getMtu)
                .tags(tags).description("Negotiated MTU").register(registry));

        operationsCounter = counter(registry, "gattlink.operations.total", tags,
                "GATT operations issued to the stack");
        failuresCounter = counter(registry, "gattlink.operations.failed.total", tags,
                "GATT operations that failed");
        overwrittenCounter = counter(registry, "gattlink.operations.overwritten.total", tags,
                "Pending operations displaced by a newer request");
        notificationsCounter = counter(registry, "gattlink.notifications.total", tags,
                "Characteristic notifications received");
        connectCounter = counter(registry, "gattlink.session.connect.total", tags,
                "Successful connections");
        connectFailedCounter = counter(registry, "gattlink.session.connect_failed.total", tags,
                "Failed connection attempts");
        disconnectCounter = counter(registry, "gattlink.session.disconnect.total", tags,
                "Disconnects");

        log.debug("[{}] Metrics bound", address);
    }

    private Counter counter(MeterRegistry registry, String name, Tags tags, String description) {
        Counter counter = Counter.builder(name).tags(tags).description(description).register(registry);
        meters.add(counter);
        return counter;
    }

    /**
     * Remove this session's meters from the registry they were bound to.
     */
    public void unbindMetrics() {
        if (meterRegistry == null) {
            return;
        }
        for (Meter meter : meters) {
            meterRegistry.remove(meter);
        }
        meters.clear();
        meterRegistry = null;
        operationsCounter = null;
        failuresCounter = null;
        overwrittenCounter = null;
        notificationsCounter = null;
        connectCounter = null;
        connectFailedCounter = null;
        disconnectCounter = null;
        log.debug("[{}] Metrics unbound", address);
    }

    // =====================================================
    // Identity and State
    // =====================================================

    public String getAddress() {
        return address;
    }

    public ConnectionState getConnectionState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public boolean isRetired() {
        lock.lock();
        try {
            return retired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the services found by the last successful discovery.
     */
    public List<GattServiceInfo> getServices() {
        lock.lock();
        try {
            return services;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the uuids currently resolvable for read, write and subscribe.
     */
    public List<UUID> getIndexedCharacteristics() {
        lock.lock();
        try {
            return List.copyOf(characteristicIndex.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int getMtu() {
        lock.lock();
        try {
            return mtu;
        } finally {
            lock.unlock();
        }
    }

    public DescriptorSlotPolicy getDescriptorSlotPolicy() {
        return descriptorSlotPolicy;
    }

    /**
     * Returns the number of outstanding completions of every kind.
     */
    public int getPendingOperationCount() {
        lock.lock();
        try {
            int count = pendingReads.size() + pendingWrites.size() + pendingDescriptorOps.size();
            if (pendingConnect != null) count++;
            if (pendingDiscovery != null) count++;
            if (pendingMtu != null) count++;
            return count;
        } finally {
            lock.unlock();
        }
    }

    // =====================================================
    // Connection
    // =====================================================

    /**
     * Request a connection.
     *
     * <p>A caller joining an attempt in progress, or connecting while already connected,
     * has its callback chained after the ones registered before it.</p>
     *
     * @param disconnectCallback run when the connection later drops, may be null
     * @return future completed when the stack reports the outcome
     */
    public CompletableFuture<Void> connect(Runnable disconnectCallback) {
        lock.lock();
        try {
            if (retired) {
                return failFast(GattException.notFound("Session retired: " + address));
            }
            if (state == ConnectionState.CONNECTED) {
                log.debug("[{}] Already connected", address);
                onDisconnect = chain(onDisconnect, disconnectCallback);
                return CompletableFuture.completedFuture(null);
            }
            if (state == ConnectionState.CONNECTING && pendingConnect != null) {
                log.debug("[{}] Connect already in progress, joining", address);
                onDisconnect = chain(onDisconnect, disconnectCallback);
                return pendingConnect.copy();
            }

            CompletableFuture<Void> future = new CompletableFuture<>();
            pendingConnect = future;
            onDisconnect = disconnectCallback;
            state = ConnectionState.CONNECTING;
            increment(operationsCounter);
            log.info("[{}] Connecting", address);

            GattConnection handle = stack.connect(address, this);
            if (handle == null) {
                log.warn("[{}] Stack refused connection request", address);
                pendingConnect = null;
                onDisconnect = null;
                state = ConnectionState.DISCONNECTED;
                increment(failuresCounter);
                increment(connectFailedCounter);
                return CompletableFuture.failedFuture(
                        GattException.platformStatus(GattConstants.GATT_FAILURE, "Connect"));
            }
            if (state == ConnectionState.CONNECTING) {
                connecting = handle;
            }
            return future;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tear the connection down.
     *
     * <p>Always succeeds. The state becomes {@link ConnectionState#DISCONNECTED}
     * immediately and every outstanding completion fails with
     * {@link GattErrorCode#DISCONNECTED}; the native teardown finishes asynchronously.</p>
     */
    public void disconnect() {
        DeferredCompletions done = new DeferredCompletions();
        Runnable dropCallback;
        lock.lock();
        try {
            if (state == ConnectionState.DISCONNECTED && connection == null && connecting == null) {
                log.debug("[{}] Already disconnected", address);
                return;
            }
            log.info("[{}] Disconnect requested in state {}", address, state);

            GattConnection handle = connection != null ? connection : connecting;
            if (handle != null) {
                handle.disconnect();
            }
            dropCallback = state == ConnectionState.CONNECTED ? onDisconnect : null;
            resetLocked(done, GattException.disconnected(address));
        } finally {
            lock.unlock();
        }
        finishDisconnect(done, dropCallback);
    }

    /**
     * Disconnect for good and release the session's meters. Later connects fail with
     * {@link GattErrorCode#NOT_FOUND}.
     */
    public void retire() {
        lock.lock();
        try {
            retired = true;
        } finally {
            lock.unlock();
        }
        disconnect();
        unbindMetrics();
        log.debug("[{}] Retired", address);
    }

    private static Runnable chain(Runnable first, Runnable second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return () -> {
            try {
                first.run();
            } finally {
                second.run();
            }
        };
    }

    @Override
    public void onConnectionStateChange(GattConnection conn, int status, int newState) {
        DeferredCompletions done = new DeferredCompletions();
        boolean connected = false;
        boolean disconnected = false;
        Runnable dropCallback = null;

        lock.lock();
        try {
            if (!isCurrent(conn)) {
                log.debug("[{}] Ignoring state change from retired handle: status={}, state={}",
                        address, status, GattConstants.getStateString(newState));
                conn.close();
                return;
            }

            if (status == GattConstants.GATT_SUCCESS && newState == GattConstants.STATE_CONNECTED) {
                if (state == ConnectionState.CONNECTED) {
                    return;
                }
                state = ConnectionState.CONNECTED;
                connection = conn;
                connecting = null;
                done.complete(pendingConnect, null);
                pendingConnect = null;
                connected = true;
                log.info("[{}] Connected", address);
            } else if (status == GattConstants.GATT_SUCCESS
                    && (newState == GattConstants.STATE_CONNECTING || newState == GattConstants.STATE_DISCONNECTING)) {
                log.debug("[{}] Transitional state {}", address, GattConstants.getStateString(newState));
                return;
            } else {
                log.info("[{}] Connection lost: status={} ({}), state={}", address, status,
                        GattConstants.getStatusString(status), GattConstants.getStateString(newState));
                if (pendingConnect != null) {
                    done.fail(pendingConnect, GattException.platformStatus(status, "Connect"));
                    pendingConnect = null;
                    increment(connectFailedCounter);
                }
                dropCallback = state == ConnectionState.CONNECTED ? onDisconnect : null;
                resetLocked(done, GattException.disconnected(address));
                conn.close();
                disconnected = true;
            }
        } finally {
            lock.unlock();
        }

        if (connected) {
            increment(connectCounter);
            notifier.connected(address);
            done.fire();
        } else if (disconnected) {
            finishDisconnect(done, dropCallback);
        }
    }

    /**
     * Clear derived state and collect every outstanding completion for failure.
     * Must be called with the lock held.
     */
    private void resetLocked(DeferredCompletions done, GattException cause) {
        state = ConnectionState.DISCONNECTED;
        connection = null;
        connecting = null;
        onDisconnect = null;
        pendingListeners.clear();
        services = List.of();
        characteristicIndex.clear();
        mtu = GattConstants.DEFAULT_MTU;

        failLocked(done, pendingConnect, cause);
        pendingConnect = null;
        failLocked(done, pendingDiscovery, cause);
        pendingDiscovery = null;
        failLocked(done, pendingMtu, cause);
        pendingMtu = null;
        for (CompletableFuture<byte[]> read : pendingReads.drain()) {
            failLocked(done, read, cause);
        }
        for (CompletableFuture<Void> write : pendingWrites.drain()) {
            failLocked(done, write, cause);
        }
        for (CompletableFuture<Void> descriptorOp : pendingDescriptorOps.drain()) {
            failLocked(done, descriptorOp, cause);
        }
    }

    private void finishDisconnect(DeferredCompletions done, Runnable dropCallback) {
        increment(disconnectCounter);
        router.removeAllListeners(address);
        notifier.disconnected(address);
        done.fire();
        if (dropCallback != null) {
            try {
                dropCallback.run();
            } catch (Exception e) {
                log.error("[{}] Disconnect callback failed", address, e);
            }
        }
    }

    private boolean isCurrent(GattConnection conn) {
        if (conn == connection || conn == connecting) {
            return conn != null;
        }
        // The stack may report before connect() has returned the handle
        return state == ConnectionState.CONNECTING && connecting == null;
    }

    // =====================================================
    // Service Discovery
    // =====================================================

    /**
     * Discover the services of the connected peripheral.
     *
     * @return future completed with the discovered services
     */
    public CompletableFuture<List<GattServiceInfo>> discoverServices() {
        DeferredCompletions done = new DeferredCompletions();
        CompletableFuture<List<GattServiceInfo>> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (connection == null) {
                return failFast(GattException.notConnected(address));
            }
            CompletableFuture<List<GattServiceInfo>> displaced = pendingDiscovery;
            pendingDiscovery = future;
            overwriteLocked(done, displaced, "Service discovery");
            increment(operationsCounter);

            if (!connection.discoverServices()) {
                pendingDiscovery = null;
                failLocked(done, future,
                        GattException.platformStatus(GattConstants.GATT_FAILURE, "Service discovery"));
            } else {
                log.debug("[{}] Service discovery started", address);
            }
        } finally {
            lock.unlock();
        }
        done.fire();
        return future;
    }

    @Override
    public void onServicesDiscovered(GattConnection conn, int status) {
        DeferredCompletions done = new DeferredCompletions();
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.warn("[{}] Ignoring discovery result from retired handle", address);
                return;
            }
            if (status == GattConstants.GATT_SUCCESS) {
                rebuildIndexLocked(conn.getServices());
                log.info("[{}] Discovered {} services, {} characteristics",
                        address, services.size(), characteristicIndex.size());
                done.complete(pendingDiscovery, services);
            } else {
                services = List.of();
                characteristicIndex.clear();
                log.warn("[{}] Service discovery failed: status={}", address, status);
                failLocked(done, pendingDiscovery, GattException.platformStatus(status, "Service discovery"));
            }
            pendingDiscovery = null;
        } finally {
            lock.unlock();
        }
        done.fire();
    }

    private void rebuildIndexLocked(List<NativeService> nativeServices) {
        characteristicIndex.clear();
        List<GattServiceInfo> snapshot = new ArrayList<>(nativeServices.size());
        for (NativeService service : nativeServices) {
            List<GattCharacteristicInfo> characteristics = new ArrayList<>();
            for (NativeCharacteristic characteristic : service.getCharacteristics()) {
                NativeCharacteristic previous = characteristicIndex.put(characteristic.getUuid(), characteristic);
                if (previous != null) {
                    log.warn("[{}] Characteristic {} is exposed by more than one service, using the one in {}",
                            address, characteristic.getUuid(), service.getUuid());
                }
                characteristics.add(new GattCharacteristicInfo(characteristic.getUuid(),
                        characteristic.getProperties(), characteristic.getDescriptorUuids()));
            }
            snapshot.add(new GattServiceInfo(service.getUuid(), service.isPrimary(), characteristics));
        }
        services = List.copyOf(snapshot);
    }

    // =====================================================
    // Read / Write
    // =====================================================

    /**
     * Read the value of a characteristic.
     *
     * @param uuid characteristic uuid
     * @return future completed with a copy of the value
     */
    public CompletableFuture<byte[]> read(UUID uuid) {
        DeferredCompletions done = new DeferredCompletions();
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (connection == null) {
                return failFast(GattException.notConnected(address));
            }
            NativeCharacteristic characteristic = characteristicIndex.get(uuid);
            if (characteristic == null) {
                return failFast(GattException.notFound("Characteristic not found: " + uuid));
            }
            overwriteLocked(done, pendingReads.put(uuid, future), "Read of " + uuid);
            increment(operationsCounter);

            if (!connection.readCharacteristic(characteristic)) {
                pendingReads.remove(uuid, future);
                failLocked(done, future, GattException.platformStatus(GattConstants.GATT_FAILURE, "Read"));
            } else {
                log.debug("[{}] Read issued: {}", address, uuid);
            }
        } finally {
            lock.unlock();
        }
        done.fire();
        return future;
    }

    /**
     * Write the value of a characteristic.
     *
     * @param uuid      characteristic uuid
     * @param value     bytes to write
     * @param writeType delivery mode
     * @return future completed when the stack confirms the write
     */
    public CompletableFuture<Void> write(UUID uuid, byte[] value, WriteType writeType) {
        Objects.requireNonNull(value, "value");
        DeferredCompletions done = new DeferredCompletions();
        CompletableFuture<Void> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (connection == null) {
                return failFast(GattException.notConnected(address));
            }
            NativeCharacteristic characteristic = characteristicIndex.get(uuid);
            if (characteristic == null) {
                return failFast(GattException.notFound("Characteristic not found: " + uuid));
            }
            overwriteLocked(done, pendingWrites.put(uuid, future), "Write of " + uuid);
            increment(operationsCounter);

            if (!connection.writeCharacteristic(characteristic, value.clone(), writeType)) {
                pendingWrites.remove(uuid, future);
                failLocked(done, future, GattException.platformStatus(GattConstants.GATT_FAILURE, "Write"));
            } else {
                log.debug("[{}] Write issued: {} ({} bytes, {})", address, uuid, value.length, writeType);
            }
        } finally {
            lock.unlock();
        }
        done.fire();
        return future;
    }

    @Override
    public void onCharacteristicRead(GattConnection conn, NativeCharacteristic characteristic,
                                     byte[] value, int status) {
        DeferredCompletions done = new DeferredCompletions();
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.warn("[{}] Ignoring read result from retired handle", address);
                return;
            }
            CompletableFuture<byte[]> future = pendingReads.take(characteristic.getUuid());
            if (future == null) {
                log.debug("[{}] Read result without pending request: {}", address, characteristic.getUuid());
                return;
            }
            if (status == GattConstants.GATT_SUCCESS) {
                done.complete(future, value != null ? value.clone() : new byte[0]);
            } else {
                failLocked(done, future, GattException.platformStatus(status, "Read"));
            }
        } finally {
            lock.unlock();
        }
        done.fire();
    }

    @Override
    public void onCharacteristicWrite(GattConnection conn, NativeCharacteristic characteristic, int status) {
        DeferredCompletions done = new DeferredCompletions();
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.warn("[{}] Ignoring write result from retired handle", address);
                return;
            }
            CompletableFuture<Void> future = pendingWrites.take(characteristic.getUuid());
            if (future == null) {
                log.debug("[{}] Write result without pending request: {}", address, characteristic.getUuid());
                return;
            }
            if (status == GattConstants.GATT_SUCCESS) {
                done.complete(future, null);
            } else {
                failLocked(done, future, GattException.platformStatus(status, "Write"));
            }
        } finally {
            lock.unlock();
        }
        done.fire();
    }

    // =====================================================
    // Notifications
    // =====================================================

    /**
     * Enable notifications (or indications) for a characteristic.
     *
     * @param uuid     characteristic uuid
     * @param listener registered with the router once enabled, may be null
     * @return future completed when the descriptor write is confirmed
     */
    public CompletableFuture<Void> subscribe(UUID uuid, CharacteristicListener listener) {
        return setNotify(uuid, true, listener);
    }

    /**
     * Disable notifications for a characteristic and drop its listeners.
     */
    public CompletableFuture<Void> unsubscribe(UUID uuid) {
        return setNotify(uuid, false, null).thenRun(() -> router.removeListeners(address, uuid));
    }

    private CompletableFuture<Void> setNotify(UUID uuid, boolean enable, CharacteristicListener listener) {
        String operation = enable ? "Subscribe" : "Unsubscribe";
        DeferredCompletions done = new DeferredCompletions();
        CompletableFuture<Void> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (connection == null) {
                return failFast(GattException.notConnected(address));
            }
            NativeCharacteristic characteristic = characteristicIndex.get(uuid);
            if (characteristic == null) {
                return failFast(GattException.notFound("Characteristic not found: " + uuid));
            }
            if (!characteristic.getDescriptorUuids().contains(GattConstants.CCCD_UUID)) {
                return failFast(GattException.notFound(
                        "Characteristic " + uuid + " has no client characteristic configuration descriptor"));
            }
            byte[] value = enable ? enableValue(characteristic) : GattConstants.DISABLE_NOTIFICATION_VALUE.clone();
            if (value == null) {
                return failFast(new GattException(GattErrorCode.NOT_SUPPORTED,
                        "Characteristic " + uuid + " supports neither notify nor indicate"));
            }

            UUID slot = descriptorSlot(uuid);
            CompletableFuture<Void> displaced = pendingDescriptorOps.put(slot, future);
            if (displaced != null) {
                pendingListeners.remove(displaced);
            }
            overwriteLocked(done, displaced, operation + " of " + uuid);
            increment(operationsCounter);

            if (!connection.setCharacteristicNotification(characteristic, enable)) {
                pendingDescriptorOps.remove(slot, future);
                failLocked(done, future, GattException.platformStatus(GattConstants.GATT_FAILURE, operation));
            } else if (!connection.writeDescriptor(characteristic, GattConstants.CCCD_UUID, value)) {
                pendingDescriptorOps.remove(slot, future);
                failLocked(done, future, GattException.platformStatus(GattConstants.GATT_FAILURE, operation));
            } else {
                if (listener != null) {
                    pendingListeners.put(future, new PendingListener(uuid, listener));
                }
                log.debug("[{}] {} issued: {}", address, operation, uuid);
            }
        } finally {
            lock.unlock();
        }
        done.fire();
        return future;
    }

    private static byte[] enableValue(NativeCharacteristic characteristic) {
        int properties = characteristic.getProperties();
        if ((properties & GattConstants.PROPERTY_NOTIFY) != 0) {
            return GattConstants.ENABLE_NOTIFICATION_VALUE.clone();
        }
        if ((properties & GattConstants.PROPERTY_INDICATE) != 0) {
            return GattConstants.ENABLE_INDICATION_VALUE.clone();
        }
        return null;
    }

    private UUID descriptorSlot(UUID characteristicUuid) {
        return descriptorSlotPolicy == DescriptorSlotPolicy.SHARED ? SHARED_DESCRIPTOR_SLOT : characteristicUuid;
    }

    @Override
    public void onDescriptorWrite(GattConnection conn, NativeCharacteristic characteristic,
                                  UUID descriptorUuid, int status) {
        DeferredCompletions done = new DeferredCompletions();
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.warn("[{}] Ignoring descriptor result from retired handle", address);
                return;
            }
            if (!GattConstants.CCCD_UUID.equals(descriptorUuid)) {
                log.debug("[{}] Ignoring write result for descriptor {}", address, descriptorUuid);
                return;
            }
            CompletableFuture<Void> future = pendingDescriptorOps.take(descriptorSlot(characteristic.getUuid()));
            if (future == null) {
                log.debug("[{}] Descriptor result without pending request: {}", address, characteristic.getUuid());
                return;
            }
            PendingListener pending = pendingListeners.remove(future);
            if (status == GattConstants.GATT_SUCCESS) {
                // Registered under the lock so a concurrent disconnect clears it afterwards
                if (pending != null) {
                    router.addListener(address, pending.uuid, pending.listener);
                }
                done.complete(future, null);
            } else {
                failLocked(done, future, GattException.platformStatus(status, "Descriptor write"));
            }
        } finally {
            lock.unlock();
        }
        done.fire();
    }

    @Override
    public void onCharacteristicChanged(GattConnection conn, NativeCharacteristic characteristic, byte[] value) {
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.debug("[{}] Dropping notification from retired handle", address);
                return;
            }
        } finally {
            lock.unlock();
        }
        increment(notificationsCounter);
        router.route(address, characteristic.getUuid(), value);
    }

    // =====================================================
    // MTU
    // =====================================================

    /**
     * Negotiate the link MTU.
     *
     * @param value requested MTU
     * @return future completed with the MTU the peripheral accepted
     */
    public CompletableFuture<Integer> requestMtu(int value) {
        DeferredCompletions done = new DeferredCompletions();
        CompletableFuture<Integer> future = new CompletableFuture<>();
        lock.lock();
        try {
            if (connection == null) {
                return failFast(new GattException(GattErrorCode.NO_GATT_SESSION,
                        "No GATT session for " + address));
            }
            CompletableFuture<Integer> displaced = pendingMtu;
            pendingMtu = future;
            overwriteLocked(done, displaced, "MTU request");
            increment(operationsCounter);

            if (!connection.requestMtu(value)) {
                pendingMtu = null;
                failLocked(done, future, GattException.platformStatus(GattConstants.GATT_FAILURE, "MTU request"));
            } else {
                log.debug("[{}] MTU {} requested", address, value);
            }
        } finally {
            lock.unlock();
        }
        done.fire();
        return future;
    }

    @Override
    public void onMtuChanged(GattConnection conn, int newMtu, int status) {
        DeferredCompletions done = new DeferredCompletions();
        lock.lock();
        try {
            if (conn != connection || conn == null) {
                log.warn("[{}] Ignoring MTU result from retired handle", address);
                return;
            }
            CompletableFuture<Integer> future = pendingMtu;
            pendingMtu = null;
            if (status == GattConstants.GATT_SUCCESS) {
                mtu = newMtu;
                log.info("[{}] MTU is now {}", address, newMtu);
                done.complete(future, newMtu);
            } else {
                failLocked(done, future, GattException.platformStatus(status, "MTU request"));
            }
        } finally {
            lock.unlock();
        }
        done.fire();
    }

    // =====================================================
    // Helpers
    // =====================================================

    private <T> CompletableFuture<T> failFast(GattException e) {
        log.debug("[{}] Request rejected: {}", address, e.getMessage());
        return CompletableFuture.failedFuture(e);
    }

    private void overwriteLocked(DeferredCompletions done, CompletableFuture<?> displaced, String operation) {
        if (displaced != null) {
            log.debug("[{}] {} displaced a pending request", address, operation);
            increment(overwrittenCounter);
            failLocked(done, displaced, GattException.overwritten(operation));
        }
    }

    private void failLocked(DeferredCompletions done, CompletableFuture<?> future, GattException cause) {
        if (future != null) {
            increment(failuresCounter);
            done.fail(future, cause);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    private static final class PendingListener {
        private final UUID uuid;
        private final CharacteristicListener listener;

        private PendingListener(UUID uuid, CharacteristicListener listener) {
            this.uuid = uuid;
            this.listener = listener;
        }
    }

    @Override
    public String toString() {
        return "GattSession{" +
                "address='" + address + '\'' +
                ", state=" + state +
                ", policy=" + descriptorSlotPolicy +
                '}';
    }
}
