package com.gattlink.config;

import com.typesafe.config.Config;

/**
 * Factory for creating {@link Component} instances from configuration.
 *
 * <p>Example:</p>
 * <pre>{@code
 * ComponentFactory<GattClient> factory = new GattClientFactory(stack, permissionGate);
 * GattClient client = factory.create("primary", ConfigLoader.load());
 * }</pre>
 *
 * @param <T> the component type to create
 */
@FunctionalInterface
public interface ComponentFactory<T extends Component> {

    /**
     * Create a component instance with the given name and configuration.
     *
     * @param name the component name (may be null for unnamed components)
     * @param config the root typesafe config
     * @return the created component
     * @throws Exception if creation fails
     */
    T create(String name, Config config) throws Exception;
}
