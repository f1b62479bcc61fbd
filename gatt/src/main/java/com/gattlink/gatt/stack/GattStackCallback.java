package com.gattlink.gatt.stack;

import java.util.UUID;

/**
 * Receiver of asynchronous native stack outcomes for one connection.
 *
 * <p>Methods may be invoked on any thread, concurrently with requests issued on the
 * same connection.</p>
 */
public interface GattStackCallback {

    void onConnectionStateChange(GattConnection connection, int status, int newState);

    void onServicesDiscovered(GattConnection connection, int status);

    void onCharacteristicRead(GattConnection connection, NativeCharacteristic characteristic,
                              byte[] value, int status);

    void onCharacteristicWrite(GattConnection connection, NativeCharacteristic characteristic, int status);

    void onDescriptorWrite(GattConnection connection, NativeCharacteristic characteristic,
                           UUID descriptorUuid, int status);

    void onMtuChanged(GattConnection connection, int mtu, int status);

    /**
     * Called when the peripheral pushes a notification or indication.
     */
    void onCharacteristicChanged(GattConnection connection, NativeCharacteristic characteristic, byte[] value);
}
