package com.gattlink.gatt.scan;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Descriptor of a device seen while scanning.
 *
 * <p>Built by the scanner from advertisement data. The client only uses the address.</p>
 */
public final class ScannedDevice {

    private final String address;
    private final String name;
    private final int rssi;
    private final List<UUID> serviceUuids;
    private final byte[] manufacturerData;

    public ScannedDevice(String address, String name, int rssi,
                         List<UUID> serviceUuids, byte[] manufacturerData) {
        this.address = Objects.requireNonNull(address, "address");
        this.name = name != null ? name : "";
        this.rssi = rssi;
        this.serviceUuids = serviceUuids != null ? List.copyOf(serviceUuids) : List.of();
        this.manufacturerData = manufacturerData != null ? manufacturerData.clone() : new byte[0];
    }

    public ScannedDevice(String address) {
        this(address, null, 0, null, null);
    }

    public String getAddress() {
        return address;
    }

    public String getName() {
        return name;
    }

    public int getRssi() {
        return rssi;
    }

    public List<UUID> getServiceUuids() {
        return serviceUuids;
    }

    public byte[] getManufacturerData() {
        return manufacturerData.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScannedDevice)) return false;
        ScannedDevice that = (ScannedDevice) o;
        return rssi == that.rssi
                && address.equals(that.address)
                && name.equals(that.name)
                && serviceUuids.equals(that.serviceUuids)
                && Arrays.equals(manufacturerData, that.manufacturerData);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(address, name, rssi, serviceUuids) + Arrays.hashCode(manufacturerData);
    }

    @Override
    public String toString() {
        return "ScannedDevice{address='" + address + "', name='" + name + "', rssi=" + rssi + '}';
    }
}
