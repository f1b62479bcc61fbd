package com.gattlink.gatt.stack;

import java.util.List;
import java.util.UUID;

/**
 * Handle to a single native GATT connection.
 *
 * <p>Every request method returns {@code false} when the stack refuses the request
 * synchronously; in that case no callback follows. A {@code true} return means exactly
 * one matching callback will be delivered later.</p>
 */
public interface GattConnection {

    /**
     * Returns the address of the remote device.
     */
    String getAddress();

    boolean discoverServices();

    /**
     * Returns the services found by the last successful discovery.
     */
    List<NativeService> getServices();

    boolean readCharacteristic(NativeCharacteristic characteristic);

    boolean writeCharacteristic(NativeCharacteristic characteristic, byte[] value, WriteType writeType);

    /**
     * Enable or disable local delivery of value changes for a characteristic.
     * This does not touch the remote descriptor.
     */
    boolean setCharacteristicNotification(NativeCharacteristic characteristic, boolean enable);

    boolean writeDescriptor(NativeCharacteristic characteristic, UUID descriptorUuid, byte[] value);

    boolean requestMtu(int mtu);

    /**
     * Request teardown of the link. A state-change callback follows.
     */
    void disconnect();

    /**
     * Release the native resources of this handle. No callbacks follow.
     */
    void close();
}
