package com.gattlink.metrics;

import com.typesafe.config.Config;

/**
 * Configuration for the metrics component.
 * Parsed from the HOCON block {@code gattlink.metrics { ... }}.
 */
public class MetricsConfig {

    public static final String CONFIG_PATH = "gattlink.metrics";

    private final boolean enabled;
    private final boolean includeJvm;

    private MetricsConfig(boolean enabled, boolean includeJvm) {
        this.enabled = enabled;
        this.includeJvm = includeJvm;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isIncludeJvm() {
        return includeJvm;
    }

    /**
     * Parse config from the root HOCON config.
     * Expected format:
     * <pre>
     * gattlink.metrics {
     *   enabled = true
     *   include-jvm = false
     * }
     * </pre>
     */
    public static MetricsConfig fromConfig(Config config) {
        boolean enabled = true;
        boolean includeJvm = false;

        if (config.hasPath(CONFIG_PATH)) {
            Config metricsConfig = config.getConfig(CONFIG_PATH);
            if (metricsConfig.hasPath("enabled")) {
                enabled = metricsConfig.getBoolean("enabled");
            }
            if (metricsConfig.hasPath("include-jvm")) {
                includeJvm = metricsConfig.getBoolean("include-jvm");
            }
        }

        return new MetricsConfig(enabled, includeJvm);
    }

    public static MetricsConfig defaults() {
        return new MetricsConfig(true, false);
    }

    @Override
    public String toString() {
        return "MetricsConfig{enabled=" + enabled + ", includeJvm=" + includeJvm + '}';
    }
}
