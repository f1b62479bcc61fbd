package com.gattlink.gatt.config;

import com.gattlink.gatt.model.GattConstants;
import com.gattlink.gatt.session.DescriptorSlotPolicy;
import com.typesafe.config.Config;

/**
 * Configuration for a {@link com.gattlink.gatt.GattClient}.
 *
 * <p>Read from the {@value #CONFIG_PATH} section. Missing keys fall back to the
 * builder defaults.</p>
 */
public final class GattClientConfig {

    public static final String CONFIG_PATH = "gattlink.client";

    private final String name;
    private final DescriptorSlotPolicy descriptorSlotPolicy;
    private final boolean requirePermission;
    private final int minMtu;
    private final int maxMtu;

    private GattClientConfig(Builder builder) {
        this.name = builder.name;
        this.descriptorSlotPolicy = builder.descriptorSlotPolicy;
        this.requirePermission = builder.requirePermission;
        this.minMtu = builder.minMtu;
        this.maxMtu = builder.maxMtu;
    }

    /**
     * Create configuration from Typesafe Config.
     *
     * @param config the {@value #CONFIG_PATH} section
     * @throws IllegalArgumentException if a value is out of range
     */
    public static GattClientConfig fromConfig(Config config) {
        Builder builder = builder();
        if (config.hasPath("name")) {
            builder.name(config.getString("name"));
        }
        if (config.hasPath("descriptor-slot-policy")) {
            builder.descriptorSlotPolicy(
                    DescriptorSlotPolicy.fromConfigValue(config.getString("descriptor-slot-policy")));
        }
        if (config.hasPath("require-permission")) {
            builder.requirePermission(config.getBoolean("require-permission"));
        }
        if (config.hasPath("min-mtu")) {
            builder.minMtu(config.getInt("min-mtu"));
        }
        if (config.hasPath("max-mtu")) {
            builder.maxMtu(config.getInt("max-mtu"));
        }
        return builder.build();
    }

    public String getName() {
        return name;
    }

    public DescriptorSlotPolicy getDescriptorSlotPolicy() {
        return descriptorSlotPolicy;
    }

    public boolean isRequirePermission() {
        return requirePermission;
    }

    public int getMinMtu() {
        return minMtu;
    }

    public int getMaxMtu() {
        return maxMtu;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "gatt-client";
        private DescriptorSlotPolicy descriptorSlotPolicy = DescriptorSlotPolicy.PER_CHARACTERISTIC;
        private boolean requirePermission = true;
        private int minMtu = GattConstants.DEFAULT_MTU;
        private int maxMtu = GattConstants.MAX_MTU;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder descriptorSlotPolicy(DescriptorSlotPolicy descriptorSlotPolicy) {
            this.descriptorSlotPolicy = descriptorSlotPolicy;
            return this;
        }

        public Builder requirePermission(boolean requirePermission) {
            this.requirePermission = requirePermission;
            return this;
        }

        public Builder minMtu(int minMtu) {
            this.minMtu = minMtu;
            return this;
        }

        public Builder maxMtu(int maxMtu) {
            this.maxMtu = maxMtu;
            return this;
        }

        public GattClientConfig build() {
            if (minMtu < GattConstants.DEFAULT_MTU || maxMtu > GattConstants.MAX_MTU || minMtu > maxMtu) {
                throw new IllegalArgumentException("Invalid MTU range [" + minMtu + ", " + maxMtu
                        + "], must lie within [" + GattConstants.DEFAULT_MTU + ", " + GattConstants.MAX_MTU + "]");
            }
            return new GattClientConfig(this);
        }
    }

    @Override
    public String toString() {
        return "GattClientConfig{" +
                "name='" + name + '\'' +
                ", descriptorSlotPolicy=" + descriptorSlotPolicy +
                ", requirePermission=" + requirePermission +
                ", minMtu=" + minMtu +
                ", maxMtu=" + maxMtu +
                '}';
    }
}
