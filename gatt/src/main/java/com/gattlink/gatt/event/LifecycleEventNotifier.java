package com.gattlink.gatt.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broadcasts connect and disconnect transitions to a single registered sink.
 *
 * <p>Delivery is best-effort: while no sink is registered, events are dropped. There is
 * no queue and no replay for a sink registered later.</p>
 */
public class LifecycleEventNotifier {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventNotifier.class);

    private final AtomicReference<LifecycleEventSink> sink = new AtomicReference<>();
    private final Clock clock;

    public LifecycleEventNotifier() {
        this(Clock.systemUTC());
    }

    public LifecycleEventNotifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register the sink, replacing any previous one.
     *
     * @param newSink the sink, or null to clear
     */
    public void setSink(LifecycleEventSink newSink) {
        sink.set(newSink);
    }

    public void clearSink() {
        sink.set(null);
    }

    public boolean hasSink() {
        return sink.get() != null;
    }

    public void connected(String address) {
        emit(LifecycleEventType.CONNECTED, address);
    }

    public void disconnected(String address) {
        emit(LifecycleEventType.DISCONNECTED, address);
    }

    /**
     * Deliver an event to the current sink, if any.
     */
    public void emit(LifecycleEventType type, String address) {
        LifecycleEventSink current = sink.get();
        if (current == null) {
            log.debug("[{}] No lifecycle sink registered, dropping {}", address, type);
            return;
        }
        LifecycleEvent event = new LifecycleEvent(type, address, clock.instant());
        try {
            current.onLifecycleEvent(event);
        } catch (Exception e) {
            log.error("[{}] Lifecycle sink failed on {}", address, type, e);
        }
    }
}
