package com.gattlink.gatt.session;

/**
 * Connection state of a {@link GattSession}.
 */
public enum ConnectionState {

    /**
     * No link. Initial and terminal state.
     */
    DISCONNECTED,

    /**
     * A native connection has been requested and its outcome is pending.
     */
    CONNECTING,

    /**
     * The stack reported a successful connection; a live handle is held.
     */
    CONNECTED;

    /**
     * @return true if a live GATT handle exists in this state
     */
    public boolean isConnected() {
        return this == CONNECTED;
    }
}
