package com.gattlink.gatt.stack;

/**
 * Delivery mode of a characteristic write.
 */
public enum WriteType {

    /** Write request, acknowledged by the peripheral. */
    WITH_RESPONSE,

    /** Write command, not acknowledged by the peripheral. */
    WITHOUT_RESPONSE
}
