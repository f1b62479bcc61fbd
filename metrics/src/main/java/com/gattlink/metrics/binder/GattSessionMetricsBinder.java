package com.gattlink.metrics.binder;

import com.gattlink.gatt.session.SessionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers aggregate session gauges from a {@link SessionRegistry}.
 */
public class GattSessionMetricsBinder implements MeterBinder {

    private static final Logger log = LoggerFactory.getLogger(GattSessionMetricsBinder.class);

    private final SessionRegistry sessionRegistry;
    private final Tags tags;

    public GattSessionMetricsBinder(SessionRegistry sessionRegistry) {
        this(sessionRegistry, Tags.empty());
    }

    public GattSessionMetricsBinder(SessionRegistry sessionRegistry, Tags tags) {
        this.sessionRegistry = sessionRegistry;
        this.tags = tags;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("gattlink.session.count", sessionRegistry, SessionRegistry::getTotalSessionCount)
                .tags(tags)
                .description("Sessions held by the registry")
                .register(registry);

        Gauge.builder("gattlink.session.connected.count", sessionRegistry, SessionRegistry::getConnectedSessionCount)
                .tags(tags)
                .description("Number of connected sessions")
                .register(registry);

        Gauge.builder("gattlink.device.known.count", sessionRegistry, SessionRegistry::getKnownDeviceCount)
                .tags(tags)
                .description("Number of devices that may be connected")
                .register(registry);

        Gauge.builder("gattlink.session.pending.count", sessionRegistry,
                        r -> r.getAllSessions().stream()
                                .mapToInt(s -> s.getPendingOperationCount())
                                .sum())
                .tags(tags)
                .description("Outstanding GATT operations across all sessions")
                .register(registry);

        log.info("Registered aggregate GATT session metrics");
    }
}
