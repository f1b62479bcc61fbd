package com.gattlink.gatt.factory;

import com.gattlink.config.ComponentFactory;
import com.gattlink.config.ConfigLoader;
import com.gattlink.gatt.GattClient;
import com.gattlink.gatt.config.GattClientConfig;
import com.gattlink.gatt.permission.PermissionGate;
import com.gattlink.gatt.stack.GattStack;
import com.typesafe.config.Config;

/**
 * Factory for creating {@link GattClient} instances.
 *
 * <p>Creates a client from the "gattlink.client" configuration section. A non-null
 * name overrides the configured one.</p>
 */
public class GattClientFactory implements ComponentFactory<GattClient> {

    private final GattStack stack;
    private final PermissionGate permissionGate;

    public GattClientFactory(GattStack stack, PermissionGate permissionGate) {
        this.stack = stack;
        this.permissionGate = permissionGate;
    }

    @Override
    public GattClient create(String name, Config config) {
        GattClientConfig clientConfig = GattClientConfig.fromConfig(
                ConfigLoader.section(config, GattClientConfig.CONFIG_PATH));
        if (name != null) {
            clientConfig = GattClientConfig.builder()
                    .name(name)
                    .descriptorSlotPolicy(clientConfig.getDescriptorSlotPolicy())
                    .requirePermission(clientConfig.isRequirePermission())
                    .minMtu(clientConfig.getMinMtu())
                    .maxMtu(clientConfig.getMaxMtu())
                    .build();
        }
        return new GattClient(clientConfig, stack, permissionGate);
    }
}
