package com.gattlink.gatt;

import com.gattlink.config.Component;
import com.gattlink.config.ComponentState;
import com.gattlink.gatt.config.GattClientConfig;
import com.gattlink.gatt.error.GattErrorCode;
import com.gattlink.gatt.error.GattException;
import com.gattlink.gatt.event.LifecycleEventNotifier;
import com.gattlink.gatt.event.LifecycleEventSink;
import com.gattlink.gatt.model.GattConstants;
import com.gattlink.gatt.model.GattServiceInfo;
import com.gattlink.gatt.notify.CharacteristicListener;
import com.gattlink.gatt.notify.NotificationRouter;
import com.gattlink.gatt.notify.NotificationSink;
import com.gattlink.gatt.permission.PermissionGate;
import com.gattlink.gatt.scan.DeviceScanner;
import com.gattlink.gatt.scan.ScanListener;
import com.gattlink.gatt.session.ConnectionState;
import com.gattlink.gatt.session.GattSession;
import com.gattlink.gatt.session.SessionRegistry;
import com.gattlink.gatt.stack.GattStack;
import com.gattlink.gatt.stack.WriteType;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Request surface for BLE peripherals, keyed by device address.
 *
 * <p>The client resolves each request to the {@link GattSession} of its address and
 * returns the session's future. Every asynchronous result completes a
 * {@link CompletableFuture}; failures complete it exceptionally with a
 * {@link GattException}.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * GattClient client = new GattClient(config, stack, permissionGate);
 * client.initialize();
 * client.start();
 *
 * client.registerDevice("AA:BB:CC:11:22:33");
 * client.connect("AA:BB:CC:11:22:33")
 *       .thenCompose(v -> client.discoverServices("AA:BB:CC:11:22:33"))
 *       .thenCompose(services -> client.read("AA:BB:CC:11:22:33", uuid))
 *       .thenAccept(value -> ...);
 * }</pre>
 *
 * <p>Requests other than {@link #disconnect(String)} and the queries require the client
 * to be started and throw {@link IllegalStateException} otherwise.</p>
 */
public class GattClient implements Component {

    private static final Logger log = LoggerFactory.getLogger(GattClient.class);

    private final GattClientConfig config;
    private final GattStack stack;
    private final PermissionGate permissionGate;
    private final NotificationRouter router;
    private final LifecycleEventNotifier notifier;
    private final SessionRegistry registry;
    private final AtomicReference<ComponentState> state = new AtomicReference<>(ComponentState.UNINITIALIZED);
    private final Map<DeviceScanner, ScanListener> scanners = new ConcurrentHashMap<>();

    private volatile MeterRegistry meterRegistry;

    public GattClient(GattClientConfig config, GattStack stack, PermissionGate permissionGate) {
        this(config, stack, permissionGate, new LifecycleEventNotifier());
    }

    /**
     * @param notifier lifecycle notifier, allowing a custom clock for event timestamps
     */
    public GattClient(GattClientConfig config, GattStack stack, PermissionGate permissionGate,
                      LifecycleEventNotifier notifier) {
        this.config = config;
        this.stack = stack;
        this.permissionGate = permissionGate;
        this.notifier = notifier;
        this.router = new NotificationRouter();
        this.registry = new SessionRegistry(config.getName(), this::newSession);
    }

    private GattSession newSession(String address) {
        GattSession session = new GattSession(address, stack, router, notifier, config.getDescriptorSlotPolicy());
        session.bindMetrics(meterRegistry, config.getName());
        return session;
    }

    // ========== Component Lifecycle ==========

    /**
     * @throws GattException with {@code NO_ADAPTER} if the stack has no usable adapter
     */
    @Override
    public void initialize() throws Exception {
        ComponentState current = state.get();
        if (current != ComponentState.UNINITIALIZED) {
            throw new IllegalStateException("Cannot initialize from state: " + current);
        }
        if (!stack.isAdapterAvailable()) {
            log.error("[{}] No Bluetooth adapter available", config.getName());
            throw new GattException(GattErrorCode.NO_ADAPTER, "No Bluetooth adapter available");
        }
        state.set(ComponentState.INITIALIZED);
        log.info("[{}] Initialized: {}", config.getName(), config);
    }

    @Override
    public void start() throws Exception {
        if (!state.compareAndSet(ComponentState.INITIALIZED, ComponentState.ACTIVE)) {
            throw new IllegalStateException("Cannot start from state: " + state.get());
        }
        log.info("[{}] Started", config.getName());
    }

    @Override
    public void stop() {
        ComponentState previous = state.getAndSet(ComponentState.STOPPED);
        if (previous == ComponentState.STOPPED) {
            return;
        }
        scanners.forEach(DeviceScanner::removeScanListener);
        scanners.clear();
        registry.clear();
        log.info("[{}] Stopped", config.getName());
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public ComponentState getState() {
        return state.get();
    }

    private void ensureActive() {
        ComponentState current = state.get();
        if (!current.isOperational()) {
            throw new IllegalStateException("Client " + config.getName() + " is not active: " + current);
        }
    }

    // ========== Devices ==========

    /**
     * Make an address connectable.
     */
    public void registerDevice(String address) {
        registry.registerDevice(address);
    }

    /**
     * Disconnect a device and forget its address and subscribers.
     */
    public void forgetDevice(String address) {
        registry.forgetDevice(address);
        router.removeDevice(address);
    }

    public Set<String> knownDevices() {
        return registry.getKnownDevices();
    }

    /**
     * Register every address the scanner reports as a known device.
     */
    public void attachScanner(DeviceScanner scanner) {
        ScanListener listener = device -> {
            if (registry.registerDevice(device.getAddress())) {
                log.debug("[{}] Discovered {} ({}, rssi={})", config.getName(),
                        device.getAddress(), device.getName(), device.getRssi());
            }
        };
        if (scanners.putIfAbsent(scanner, listener) == null) {
            scanner.addScanListener(listener);
        }
    }

    public void detachScanner(DeviceScanner scanner) {
        ScanListener listener = scanners.remove(scanner);
        if (listener != null) {
            scanner.removeScanListener(listener);
        }
    }

    // ========== Connection ==========

    public CompletableFuture<Void> connect(String address) {
        return connect(address, null);
    }

    /**
     * Connect to a known device.
     *
     * <p>Callbacks passed by callers that join an attempt in progress, or connect while
     * already connected, all run when the connection drops, in registration order.</p>
     *
     * @param onDisconnect run when the established connection later drops, may be null
     * @return future completed once connected
     */
    public CompletableFuture<Void> connect(String address, Runnable onDisconnect) {
        ensureActive();
        if (config.isRequirePermission() && !permissionGate.isGranted()) {
            log.warn("[{}] Bluetooth permission denied, not connecting to {}", config.getName(), address);
            return CompletableFuture.failedFuture(
                    new GattException(GattErrorCode.PERMISSION_DENIED, "Bluetooth permission denied"));
        }
        GattSession session;
        try {
            session = registry.openSession(address);
        } catch (GattException e) {
            return CompletableFuture.failedFuture(e);
        }
        return session.connect(onDisconnect);
    }

    /**
     * Disconnect a device. Never fails, including for unknown addresses.
     */
    public void disconnect(String address) {
        registry.getSession(address).ifPresent(GattSession::disconnect);
    }

    public boolean isConnected(String address) {
        return registry.getSession(address).map(GattSession::isConnected).orElse(false);
    }

    public ConnectionState connectionState(String address) {
        return registry.getSession(address)
                .map(GattSession::getConnectionState)
                .orElse(ConnectionState.DISCONNECTED);
    }

    public List<String> connectedDevices() {
        return registry.getConnectedSessions().stream()
                .map(GattSession::getAddress)
                .collect(Collectors.toUnmodifiableList());
    }

    // ========== Services ==========

    public CompletableFuture<List<GattServiceInfo>> discoverServices(String address) {
        ensureActive();
        return withSession(address, GattErrorCode.NOT_CONNECTED, GattSession::discoverServices);
    }

    /**
     * Snapshot of the services found by the last discovery, empty if none ran.
     */
    public List<GattServiceInfo> listServices(String address) {
        return registry.getSession(address).map(GattSession::getServices).orElse(List.of());
    }

    // ========== Read / Write ==========

    public CompletableFuture<byte[]> read(String address, UUID characteristic) {
        ensureActive();
        return withSession(address, GattErrorCode.NOT_CONNECTED, s -> s.read(characteristic));
    }

    /**
     * @param withResponse whether the peripheral must acknowledge the write
     */
    public CompletableFuture<Void> write(String address, UUID characteristic, byte[] value, boolean withResponse) {
        ensureActive();
        WriteType writeType = withResponse ? WriteType.WITH_RESPONSE : WriteType.WITHOUT_RESPONSE;
        return withSession(address, GattErrorCode.NOT_CONNECTED, s -> s.write(characteristic, value, writeType));
    }

    public CompletableFuture<Void> writeWithResponse(String address, UUID characteristic, byte[] value) {
        return write(address, characteristic, value, true);
    }

    public CompletableFuture<Void> writeWithoutResponse(String address, UUID characteristic, byte[] value) {
        return write(address, characteristic, value, false);
    }

    // ========== Notifications ==========

    public CompletableFuture<Void> subscribe(String address, UUID characteristic) {
        return subscribe(address, characteristic, null);
    }

    /**
     * Enable notifications for a characteristic.
     *
     * @param listener receives values of this characteristic once enabled, may be null
     */
    public CompletableFuture<Void> subscribe(String address, UUID characteristic, CharacteristicListener listener) {
        ensureActive();
        return withSession(address, GattErrorCode.NOT_CONNECTED, s -> s.subscribe(characteristic, listener));
    }

    public CompletableFuture<Void> unsubscribe(String address, UUID characteristic) {
        ensureActive();
        return withSession(address, GattErrorCode.NOT_CONNECTED, s -> s.unsubscribe(characteristic));
    }

    /**
     * Receive every notification of a device, whatever the characteristic.
     */
    public void setNotificationSink(String address, NotificationSink sink) {
        router.setSink(address, sink);
    }

    public void clearNotificationSink(String address) {
        router.clearSink(address);
    }

    // ========== MTU ==========

    /**
     * Negotiate the MTU of a connected device.
     *
     * @throws IllegalArgumentException if the value is outside the configured range
     */
    public CompletableFuture<Integer> requestMtu(String address, int mtu) {
        ensureActive();
        if (mtu < config.getMinMtu() || mtu > config.getMaxMtu()) {
            throw new IllegalArgumentException("MTU " + mtu + " outside ["
                    + config.getMinMtu() + ", " + config.getMaxMtu() + "]");
        }
        return withSession(address, GattErrorCode.NO_GATT_SESSION, s -> s.requestMtu(mtu));
    }

    public int getMtu(String address) {
        return registry.getSession(address).map(GattSession::getMtu).orElse(GattConstants.DEFAULT_MTU);
    }

    // ========== Lifecycle Events ==========

    public void setLifecycleEventSink(LifecycleEventSink sink) {
        notifier.setSink(sink);
    }

    public void clearLifecycleEventSink() {
        notifier.clearSink();
    }

    // ========== Metrics ==========

    /**
     * Bind per-session meters. Sessions created later are bound on creation.
     *
     * @param registry the meter registry (null to disable metrics for new sessions)
     */
    public void bindMetrics(MeterRegistry registry) {
        this.meterRegistry = registry;
        for (GattSession session : this.registry.getAllSessions()) {
            session.bindMetrics(registry, config.getName());
        }
    }

    public SessionRegistry getSessionRegistry() {
        return registry;
    }

    public GattClientConfig getConfig() {
        return config;
    }

    private <T> CompletableFuture<T> withSession(String address, GattErrorCode missing,
                                                 Function<GattSession, CompletableFuture<T>> request) {
        Optional<GattSession> session = registry.getSession(address);
        if (session.isEmpty()) {
            return CompletableFuture.failedFuture(missing == GattErrorCode.NO_GATT_SESSION
                    ? new GattException(GattErrorCode.NO_GATT_SESSION, "No GATT session for " + address)
                    : GattException.notConnected(address));
        }
        return request.apply(session.get());
    }
}
