package com.gattlink.gatt.event;

import java.time.Instant;
import java.util.Objects;

/**
 * A connect or disconnect transition of one device.
 */
public final class LifecycleEvent {

    private final LifecycleEventType type;
    private final String address;
    private final Instant timestamp;

    public LifecycleEvent(LifecycleEventType type, String address, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.address = Objects.requireNonNull(address, "address");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public LifecycleEventType getType() {
        return type;
    }

    public String getAddress() {
        return address;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LifecycleEvent)) return false;
        LifecycleEvent that = (LifecycleEvent) o;
        return type == that.type && address.equals(that.address) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, address, timestamp);
    }

    @Override
    public String toString() {
        return type + "(" + address + ")";
    }
}
