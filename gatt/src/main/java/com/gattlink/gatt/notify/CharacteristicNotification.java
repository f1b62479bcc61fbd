package com.gattlink.gatt.notify;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A value pushed by a peripheral for one characteristic.
 */
public final class CharacteristicNotification {

    private final String address;
    private final UUID uuid;
    private final byte[] payload;

    public CharacteristicNotification(String address, UUID uuid, byte[] payload) {
        this.address = Objects.requireNonNull(address, "address");
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.payload = payload != null ? payload.clone() : new byte[0];
    }

    public String getAddress() {
        return address;
    }

    public UUID getUuid() {
        return uuid;
    }

    /**
     * Returns a copy of the notified value.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public int getLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacteristicNotification)) return false;
        CharacteristicNotification that = (CharacteristicNotification) o;
        return address.equals(that.address) && uuid.equals(that.uuid) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(address, uuid) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "CharacteristicNotification{" +
                "address='" + address + '\'' +
                ", uuid=" + uuid +
                ", length=" + payload.length +
                '}';
    }
}
