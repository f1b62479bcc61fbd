package com.gattlink.gatt.model;

import java.util.UUID;

/**
 * Constants shared with the native GATT stack.
 *
 * <p>Status and state values follow the numbering used by the Android Bluetooth stack so
 * that a platform binding can pass them through unchanged.</p>
 */
public final class GattConstants {

    private GattConstants() {
    }

    // ==================== Status Codes ====================

    public static final int GATT_SUCCESS = 0x00;
    public static final int GATT_INVALID_HANDLE = 0x01;
    public static final int GATT_READ_NOT_PERMITTED = 0x02;
    public static final int GATT_WRITE_NOT_PERMITTED = 0x03;
    public static final int GATT_INSUFFICIENT_AUTHENTICATION = 0x05;
    public static final int GATT_REQUEST_NOT_SUPPORTED = 0x06;
    public static final int GATT_INVALID_OFFSET = 0x07;
    public static final int GATT_INVALID_ATTRIBUTE_LENGTH = 0x0D;
    public static final int GATT_INSUFFICIENT_ENCRYPTION = 0x0F;
    public static final int GATT_CONNECTION_TIMEOUT = 0x08;
    public static final int GATT_ERROR = 0x85;
    public static final int GATT_CONNECTION_CONGESTED = 0x8F;
    /** Generic failure, also used when the stack refuses a request synchronously. */
    public static final int GATT_FAILURE = 0x101;

    // ==================== Connection States ====================

    public static final int STATE_DISCONNECTED = 0;
    public static final int STATE_CONNECTING = 1;
    public static final int STATE_CONNECTED = 2;
    public static final int STATE_DISCONNECTING = 3;

    // ==================== Characteristic Properties ====================

    public static final int PROPERTY_BROADCAST = 0x01;
    public static final int PROPERTY_READ = 0x02;
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;
    public static final int PROPERTY_WRITE = 0x08;
    public static final int PROPERTY_NOTIFY = 0x10;
    public static final int PROPERTY_INDICATE = 0x20;
    public static final int PROPERTY_SIGNED_WRITE = 0x40;
    public static final int PROPERTY_EXTENDED_PROPS = 0x80;

    // ==================== Descriptors ====================

    /** Client Characteristic Configuration Descriptor. */
    public static final UUID CCCD_UUID = uuidFrom16Bit(0x2902);

    public static final byte[] ENABLE_NOTIFICATION_VALUE = {0x01, 0x00};
    public static final byte[] ENABLE_INDICATION_VALUE = {0x02, 0x00};
    public static final byte[] DISABLE_NOTIFICATION_VALUE = {0x00, 0x00};

    // ==================== MTU ====================

    public static final int DEFAULT_MTU = 23;
    public static final int MAX_MTU = 517;

    private static final long BASE_UUID_LSB = 0x800000805F9B34FBL;

    /**
     * Expands a 16-bit assigned number onto the Bluetooth base UUID.
     *
     * @param shortUuid 16-bit UUID
     * @return full 128-bit UUID
     */
    public static UUID uuidFrom16Bit(int shortUuid) {
        long msb = ((long) (shortUuid & 0xFFFF) << 32) | 0x1000L;
        return new UUID(msb, BASE_UUID_LSB);
    }

    /**
     * Returns a readable name for a native status code.
     *
     * @param status status code
     * @return name of the status
     */
    public static String getStatusString(int status) {
        switch (status) {
            case GATT_SUCCESS: return "Success";
            case GATT_INVALID_HANDLE: return "Invalid Handle";
            case GATT_READ_NOT_PERMITTED: return "Read Not Permitted";
            case GATT_WRITE_NOT_PERMITTED: return "Write Not Permitted";
            case GATT_INSUFFICIENT_AUTHENTICATION: return "Insufficient Authentication";
            case GATT_REQUEST_NOT_SUPPORTED: return "Request Not Supported";
            case GATT_INVALID_OFFSET: return "Invalid Offset";
            case GATT_CONNECTION_TIMEOUT: return "Connection Timeout";
            case GATT_INVALID_ATTRIBUTE_LENGTH: return "Invalid Attribute Length";
            case GATT_INSUFFICIENT_ENCRYPTION: return "Insufficient Encryption";
            case GATT_ERROR: return "GATT Error";
            case GATT_CONNECTION_CONGESTED: return "Connection Congested";
            case GATT_FAILURE: return "Failure";
            default: return "Unknown Status";
        }
    }

    /**
     * Returns a readable name for a native connection state.
     */
    public static String getStateString(int state) {
        switch (state) {
            case STATE_DISCONNECTED: return "DISCONNECTED";
            case STATE_CONNECTING: return "CONNECTING";
            case STATE_CONNECTED: return "CONNECTED";
            case STATE_DISCONNECTING: return "DISCONNECTING";
            default: return "UNKNOWN(" + state + ")";
        }
    }
}
