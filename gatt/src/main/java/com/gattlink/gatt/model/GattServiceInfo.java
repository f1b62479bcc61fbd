package com.gattlink.gatt.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable snapshot of a discovered service and its characteristics.
 */
public final class GattServiceInfo {

    private final UUID uuid;
    private final boolean primary;
    private final List<GattCharacteristicInfo> characteristics;

    public GattServiceInfo(UUID uuid, boolean primary, List<GattCharacteristicInfo> characteristics) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.primary = primary;
        this.characteristics = List.copyOf(characteristics);
    }

    public UUID getUuid() {
        return uuid;
    }

    public boolean isPrimary() {
        return primary;
    }

    /**
     * Returns the characteristics in discovery order.
     */
    public List<GattCharacteristicInfo> getCharacteristics() {
        return characteristics;
    }

    public Optional<GattCharacteristicInfo> getCharacteristic(UUID characteristicUuid) {
        return characteristics.stream()
                .filter(c -> c.getUuid().equals(characteristicUuid))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GattServiceInfo)) return false;
        GattServiceInfo that = (GattServiceInfo) o;
        return primary == that.primary
                && uuid.equals(that.uuid)
                && characteristics.equals(that.characteristics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, primary, characteristics);
    }

    @Override
    public String toString() {
        return "GattServiceInfo{" +
                "uuid=" + uuid +
                ", primary=" + primary +
                ", characteristics=" + characteristics.size() +
                '}';
    }
}
