package com.gattlink.gatt.stack;

import java.util.List;
import java.util.UUID;

/**
 * Stack-native handle for a characteristic.
 *
 * <p>Instances are passed back to the {@link GattConnection} unchanged; the client never
 * creates them itself.</p>
 */
public interface NativeCharacteristic {

    UUID getUuid();

    /**
     * Returns the properties bitmask, see {@code GattConstants.PROPERTY_*}.
     */
    int getProperties();

    /**
     * Returns the uuids of the descriptors attached to this characteristic.
     */
    List<UUID> getDescriptorUuids();
}
