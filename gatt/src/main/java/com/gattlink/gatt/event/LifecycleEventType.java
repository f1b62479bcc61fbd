package com.gattlink.gatt.event;

/**
 * Connection lifecycle transitions broadcast by the client.
 */
public enum LifecycleEventType {
    CONNECTED,
    DISCONNECTED
}
