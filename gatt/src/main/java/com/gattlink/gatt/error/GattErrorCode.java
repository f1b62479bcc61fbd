package com.gattlink.gatt.error;

/**
 * Failure categories surfaced by the client.
 */
public enum GattErrorCode {

    /** Unknown device address or characteristic uuid. */
    NOT_FOUND,

    /** The operation requires an established connection. */
    NOT_CONNECTED,

    /** No live GATT handle at the time the request was issued. */
    NO_GATT_SESSION,

    /** A newer request for the same slot displaced this one. */
    OPERATION_OVERWRITTEN,

    /** The native stack reported a non-success status. */
    PLATFORM_STATUS,

    /** The permission gate refused the radio operation. */
    PERMISSION_DENIED,

    /** The connection was torn down while the operation was outstanding. */
    DISCONNECTED,

    /** The characteristic does not declare the capability the request needs. */
    NOT_SUPPORTED,

    /** No Bluetooth adapter is available. Raised at initialization only. */
    NO_ADAPTER
}
