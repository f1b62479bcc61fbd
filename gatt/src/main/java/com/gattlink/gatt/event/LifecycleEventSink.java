package com.gattlink.gatt.event;

/**
 * Process-wide receiver of {@link LifecycleEvent}s.
 */
@FunctionalInterface
public interface LifecycleEventSink {

    /**
     * Called on the thread that performed the transition, usually a stack callback thread.
     *
     * @param event the transition
     */
    void onLifecycleEvent(LifecycleEvent event);
}
