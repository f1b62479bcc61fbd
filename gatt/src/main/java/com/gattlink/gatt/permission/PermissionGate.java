package com.gattlink.gatt.permission;

/**
 * Synchronous precondition checked before every connection attempt.
 *
 * <p>An implementation may show a platform permission prompt as a side effect, but must
 * return without waiting for the user.</p>
 */
@FunctionalInterface
public interface PermissionGate {

    /** Gate that grants every request. */
    PermissionGate ALLOW_ALL = () -> true;

    /**
     * @return true if radio operations are currently permitted
     */
    boolean isGranted();
}
