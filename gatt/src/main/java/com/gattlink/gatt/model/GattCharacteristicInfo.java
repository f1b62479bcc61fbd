package com.gattlink.gatt.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of a discovered characteristic.
 */
public final class GattCharacteristicInfo {

    private final UUID uuid;
    private final int properties;
    private final List<UUID> descriptors;

    public GattCharacteristicInfo(UUID uuid, int properties, List<UUID> descriptors) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.properties = properties;
        this.descriptors = List.copyOf(descriptors);
    }

    public UUID getUuid() {
        return uuid;
    }

    /**
     * Returns the properties bitmask, see {@code GattConstants.PROPERTY_*}.
     */
    public int getProperties() {
        return properties;
    }

    public List<UUID> getDescriptors() {
        return descriptors;
    }

    public boolean hasProperty(int property) {
        return (properties & property) != 0;
    }

    public boolean canRead() {
        return hasProperty(GattConstants.PROPERTY_READ);
    }

    public boolean canWrite() {
        return hasProperty(GattConstants.PROPERTY_WRITE)
                || hasProperty(GattConstants.PROPERTY_WRITE_NO_RESPONSE);
    }

    public boolean canNotify() {
        return hasProperty(GattConstants.PROPERTY_NOTIFY)
                || hasProperty(GattConstants.PROPERTY_INDICATE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GattCharacteristicInfo)) return false;
        GattCharacteristicInfo that = (GattCharacteristicInfo) o;
        return properties == that.properties
                && uuid.equals(that.uuid)
                && descriptors.equals(that.descriptors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, properties, descriptors);
    }

    @Override
    public String toString() {
        return String.format("GattCharacteristicInfo{uuid=%s, properties=0x%02X, descriptors=%s}",
                uuid, properties, descriptors);
    }
}
