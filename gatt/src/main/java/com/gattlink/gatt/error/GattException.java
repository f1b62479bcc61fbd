package com.gattlink.gatt.error;

import com.gattlink.gatt.model.GattConstants;

/**
 * Exception raised for failed GATT requests.
 *
 * <p>Requests return {@link java.util.concurrent.CompletableFuture}s; failures complete
 * them exceptionally with an instance of this class. Platform failures also carry the
 * native status code reported by the stack.</p>
 */
public class GattException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Marker for errors that did not originate from the native stack. */
    public static final int NO_STATUS = -1;

    private final GattErrorCode errorCode;
    private final int status;

    /**
     * Creates an exception for a non-platform failure.
     *
     * @param errorCode the failure category
     * @param message   human-readable detail
     */
    public GattException(GattErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = NO_STATUS;
    }

    private GattException(int status, String message) {
        super(message);
        this.errorCode = GattErrorCode.PLATFORM_STATUS;
        this.status = status;
    }

    /**
     * Creates a {@link GattErrorCode#PLATFORM_STATUS} exception.
     *
     * @param status    the native status code
     * @param operation the operation that failed, used in the message
     * @return the exception
     */
    public static GattException platformStatus(int status, String operation) {
        return new GattException(status, String.format("%s failed: %s (status=0x%02X)",
                operation, GattConstants.getStatusString(status), status));
    }

    public static GattException notFound(String message) {
        return new GattException(GattErrorCode.NOT_FOUND, message);
    }

    public static GattException notConnected(String address) {
        return new GattException(GattErrorCode.NOT_CONNECTED, "Device not connected: " + address);
    }

    public static GattException overwritten(String operation) {
        return new GattException(GattErrorCode.OPERATION_OVERWRITTEN,
                operation + " was overwritten by a newer request");
    }

    public static GattException disconnected(String address) {
        return new GattException(GattErrorCode.DISCONNECTED, "Device disconnected: " + address);
    }

    public GattErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the native status code.
     *
     * @return status for platform failures, {@link #NO_STATUS} otherwise
     */
    public int getStatus() {
        return status;
    }

    /**
     * Unwraps a throwable produced by a failed future.
     *
     * @param throwable the failure, possibly wrapped in a CompletionException
     * @return the GattException, or null if the failure has another cause
     */
    public static GattException unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof GattException) {
                return (GattException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}
