package com.gattlink.gatt.stack;

/**
 * Entry point into the native Bluetooth stack.
 *
 * <p>Implementations bind the client to a platform radio. All outcomes are reported
 * asynchronously through the {@link GattStackCallback} given to {@link #connect}, on a
 * thread of the stack's choosing.</p>
 */
public interface GattStack {

    /**
     * Check if a Bluetooth adapter is present and usable.
     *
     * @return true if the adapter is available
     */
    boolean isAdapterAvailable();

    /**
     * Start connecting to a peripheral.
     *
     * <p>The returned handle is not usable until the callback reports
     * {@code STATE_CONNECTED} with {@code GATT_SUCCESS}.</p>
     *
     * @param address  device address
     * @param callback receiver of every outcome on this connection
     * @return the connection handle, or null if the stack refused the request
     */
    GattConnection connect(String address, GattStackCallback callback);
}
