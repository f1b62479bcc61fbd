package com.gattlink.gatt.session;

import com.gattlink.gatt.error.GattException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps device addresses to their {@link GattSession}.
 *
 * <p>A device must be known before a session can be opened for it. Addresses become
 * known through scan results or explicit registration. Sessions are created lazily on
 * the first connect and kept, reset to disconnected, after the link drops so the
 * address can be reconnected.</p>
 *
 * <p>Opening and removing sessions are serialised on a registry lock, so an address
 * is never forgotten between the known-device check and session creation. A removed
 * session is retired outside that lock: it is disconnected and refuses any later
 * connect, so a caller still holding it cannot bring up a link the registry no longer
 * tracks.</p>
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final String name;
    private final Function<String, GattSession> sessionFactory;
    private final Set<String> knownDevices = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, GattSession> sessions = new ConcurrentHashMap<>();
    private final Object registryLock = new Object();

    /**
     * @param name           owner name used in log messages
     * @param sessionFactory creates a session for an address
     */
    public SessionRegistry(String name, Function<String, GattSession> sessionFactory) {
        this.name = name;
        this.sessionFactory = sessionFactory;
    }

    // ========== Known Devices ==========

    /**
     * Mark an address as known so that sessions may be opened for it.
     *
     * @return true if the address was not known before
     */
    public boolean registerDevice(String address) {
        boolean added = knownDevices.add(address);
        if (added) {
            log.debug("[{}] Device registered: {}", name, address);
        }
        return added;
    }

    public boolean isKnown(String address) {
        return knownDevices.contains(address);
    }

    public Set<String> getKnownDevices() {
        return Collections.unmodifiableSet(knownDevices);
    }

    /**
     * Forget a device: its session is disconnected and removed along with the address.
     *
     * @return true if the address was known
     */
    public boolean forgetDevice(String address) {
        GattSession session;
        boolean removed;
        synchronized (registryLock) {
            session = sessions.remove(address);
            removed = knownDevices.remove(address);
        }
        retire(session);
        if (removed) {
            log.info("[{}] Device forgotten: {}", name, address);
        }
        return removed;
    }

    // ========== Sessions ==========

    /**
     * Get the session for a known address, creating it on first use.
     *
     * @throws GattException with {@code NOT_FOUND} if the address is not known
     */
    public GattSession openSession(String address) throws GattException {
        synchronized (registryLock) {
            if (!knownDevices.contains(address)) {
                throw GattException.notFound("Unknown device: " + address);
            }
            return sessions.computeIfAbsent(address, a -> {
                log.info("[{}] Created session: {}", name, a);
                return sessionFactory.apply(a);
            });
        }
    }

    public Optional<GattSession> getSession(String address) {
        return Optional.ofNullable(sessions.get(address));
    }

    /**
     * Remove the session for an address and retire it.
     *
     * @return the removed session, or null
     */
    public GattSession removeSession(String address) {
        GattSession removed;
        synchronized (registryLock) {
            removed = sessions.remove(address);
        }
        retire(removed);
        return removed;
    }

    private void retire(GattSession session) {
        if (session != null) {
            session.retire();
            log.info("[{}] Removed session: {}", name, session.getAddress());
        }
    }

    public Collection<GattSession> getAllSessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public List<GattSession> getConnectedSessions() {
        return sessions.values().stream()
                .filter(GattSession::isConnected)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Disconnect every session and drop them all. Known addresses are kept.
     */
    public void clear() {
        log.info("[{}] Closing all {} sessions", name, sessions.size());
        for (String address : List.copyOf(sessions.keySet())) {
            try {
                removeSession(address);
            } catch (RuntimeException e) {
                log.error("[{}] Error closing session: {}", name, address, e);
            }
        }
    }

    // ========== Statistics ==========

    public int getTotalSessionCount() {
        return sessions.size();
    }

    public int getConnectedSessionCount() {
        return (int) sessions.values().stream()
                .filter(GattSession::isConnected)
                .count();
    }

    public int getKnownDeviceCount() {
        return knownDevices.size();
    }
}
