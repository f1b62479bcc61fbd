package com.gattlink.metrics;

import com.gattlink.config.Component;
import com.gattlink.config.ComponentState;
import com.gattlink.gatt.GattClient;
import com.gattlink.metrics.binder.GattSessionMetricsBinder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics component wrapping a {@link PrometheusMeterRegistry}.
 *
 * <p>Clients handed to {@link #bindClient(GattClient)} get their per-session meters and
 * the aggregate registry gauges registered here.</p>
 */
public class MetricsComponent implements Component {

    private static final Logger log = LoggerFactory.getLogger(MetricsComponent.class);

    private final String name;
    private final MetricsConfig config;
    private final AtomicReference<ComponentState> state = new AtomicReference<>(ComponentState.UNINITIALIZED);
    private PrometheusMeterRegistry registry;

    public MetricsComponent(String name, MetricsConfig config) {
        this.name = name;
        this.config = config;
    }

    /**
     * Get the Prometheus meter registry.
     * Available after initialization, null when metrics are disabled.
     */
    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    public MeterRegistry getMeterRegistry() {
        return registry;
    }

    public MetricsConfig getMetricsConfig() {
        return config;
    }

    /**
     * Register the meters of a client. Does nothing while metrics are disabled.
     */
    public void bindClient(GattClient client) {
        if (registry == null) {
            log.debug("[{}] Metrics disabled, not binding client {}", name, client.getName());
            return;
        }
        client.bindMetrics(registry);
        new GattSessionMetricsBinder(client.getSessionRegistry(), Tags.of("client", client.getName()))
                .bindTo(registry);
        log.info("[{}] Bound metrics for client {}", name, client.getName());
    }

    /**
     * Scrape all metrics in Prometheus text format.
     */
    public String scrape() {
        if (registry == null) {
            return "";
        }
        return registry.scrape();
    }

    @Override
    public void initialize() throws Exception {
        if (!state.compareAndSet(ComponentState.UNINITIALIZED, ComponentState.INITIALIZED)) {
            throw new IllegalStateException("Cannot initialize from state: " + state.get());
        }

        if (!config.isEnabled()) {
            log.info("[{}] Metrics disabled", name);
            return;
        }

        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (config.isIncludeJvm()) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ClassLoaderMetrics().bindTo(registry);
            log.info("[{}] JVM metrics binders registered", name);
        }

        log.info("[{}] Metrics component initialized", name);
    }

    @Override
    public void start() throws Exception {
        if (!state.compareAndSet(ComponentState.INITIALIZED, ComponentState.ACTIVE)) {
            throw new IllegalStateException("Cannot start from state: " + state.get());
        }
        log.info("[{}] Metrics component active", name);
    }

    @Override
    public void stop() {
        if (state.getAndSet(ComponentState.STOPPED) == ComponentState.STOPPED) {
            return;
        }
        log.info("[{}] Stopping metrics component", name);
        if (registry != null) {
            registry.close();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ComponentState getState() {
        return state.get();
    }
}
