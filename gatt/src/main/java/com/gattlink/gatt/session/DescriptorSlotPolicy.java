package com.gattlink.gatt.session;

/**
 * How subscribe and unsubscribe completions are correlated within a session.
 */
public enum DescriptorSlotPolicy {

    /**
     * One outstanding descriptor operation per characteristic. Concurrent calls on
     * different characteristics never interfere.
     */
    PER_CHARACTERISTIC,

    /**
     * A single outstanding descriptor operation per session. A second call on any
     * characteristic displaces the first, and may receive the outcome of the first
     * call's descriptor write.
     */
    SHARED;

    /**
     * Parse a HOCON value such as {@code "per-characteristic"} or {@code "shared"}.
     *
     * @param value the configured value
     * @return the policy
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static DescriptorSlotPolicy fromConfigValue(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown descriptor slot policy: " + value, e);
        }
    }
}
