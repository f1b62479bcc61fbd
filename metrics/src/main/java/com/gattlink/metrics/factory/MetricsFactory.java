package com.gattlink.metrics.factory;

import com.gattlink.config.ComponentFactory;
import com.gattlink.metrics.MetricsComponent;
import com.gattlink.metrics.MetricsConfig;
import com.typesafe.config.Config;

/**
 * Factory for creating {@link MetricsComponent} instances from the
 * {@code gattlink.metrics} section.
 */
public class MetricsFactory implements ComponentFactory<MetricsComponent> {

    @Override
    public MetricsComponent create(String name, Config config) {
        String componentName = name != null ? name : "metrics";
        return new MetricsComponent(componentName, MetricsConfig.fromConfig(config));
    }
}
