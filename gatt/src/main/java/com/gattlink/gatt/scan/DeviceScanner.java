package com.gattlink.gatt.scan;

/**
 * Platform scanner producing a live stream of discovered devices.
 *
 * <p>Scan control (filters, duration, start/stop) belongs to the platform binding. The
 * client only attaches a listener to learn addresses it may connect to.</p>
 */
public interface DeviceScanner {

    void addScanListener(ScanListener listener);

    void removeScanListener(ScanListener listener);
}
