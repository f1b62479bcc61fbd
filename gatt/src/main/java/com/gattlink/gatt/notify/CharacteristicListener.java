package com.gattlink.gatt.notify;

/**
 * Receives the values of a single subscribed characteristic.
 */
@FunctionalInterface
public interface CharacteristicListener {

    /**
     * @param value a copy of the notified value
     */
    void onValue(byte[] value);
}
