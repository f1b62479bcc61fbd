package com.gattlink.gatt.notify;

/**
 * Per-session channel receiving every notification of a device, tagged with its uuid.
 */
@FunctionalInterface
public interface NotificationSink {

    void onNotification(CharacteristicNotification notification);
}
