package com.gattlink.gatt.stack;

import java.util.List;
import java.util.UUID;

/**
 * A service as reported by the native stack after discovery.
 */
public interface NativeService {

    UUID getUuid();

    boolean isPrimary();

    /**
     * Returns the characteristics of this service in discovery order.
     */
    List<NativeCharacteristic> getCharacteristics();
}
