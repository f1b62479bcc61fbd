package com.gattlink.gatt.scan;

/**
 * Receives devices pushed by a {@link DeviceScanner}.
 */
@FunctionalInterface
public interface ScanListener {

    void onDeviceFound(ScannedDevice device);
}
