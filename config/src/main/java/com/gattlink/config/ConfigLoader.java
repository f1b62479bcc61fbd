package com.gattlink.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and merges HOCON configuration for the client.
 *
 * <p>Sources are layered in the following order (later sources override earlier):
 * <ol>
 *   <li>reference.conf (from classpath - module defaults)</li>
 *   <li>application.conf (from classpath)</li>
 *   <li>Config files given to {@link #load(String...)} or {@link #load(List)}</li>
 *   <li>Explicit overrides added through the builder</li>
 *   <li>System properties</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Config config = ConfigLoader.load("gattlink.conf");
 * GattClientConfig clientConfig = GattClientConfig.fromConfig(
 *         ConfigLoader.section(config, GattClientConfig.CONFIG_PATH));
 *
 * // Or with more control
 * Config config = ConfigLoader.builder()
 *     .addFile("base.conf")
 *     .withOverride("gattlink.client.descriptor-slot-policy", "shared")
 *     .withSystemProperties(false)
 *     .build();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Load configuration using the default order:
     * reference.conf -> application.conf -> system properties.
     */
    public static Config load() {
        return ConfigFactory.load();
    }

    /**
     * Load configuration with additional config files.
     * Files are loaded in order, with later files overriding earlier ones.
     *
     * @param configFiles paths to config files (filesystem or classpath)
     * @return merged configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load configuration with additional config files.
     *
     * @param configFiles list of paths to config files
     * @return merged configuration
     */
    public static Config load(List<String> configFiles) {
        return builder().addFiles(configFiles).build();
    }

    /**
     * Get a nested section, or an empty config when the path is absent.
     *
     * @param root the root configuration
     * @param path the dotted path of the section
     * @return the section, never null
     */
    public static Config section(Config root, String path) {
        if (root.hasPath(path)) {
            return root.getConfig(path);
        }
        log.debug("Config section not present: {}", path);
        return ConfigFactory.empty();
    }

    /**
     * Create a builder for more control over configuration loading.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for layered configuration.
     */
    public static final class Builder {
        private final List<String> configFiles = new ArrayList<>();
        private final Map<String, Object> overrides = new LinkedHashMap<>();
        private boolean includeSystemProperties = true;
        private boolean includeApplicationConf = true;
        private boolean includeReferenceConf = true;

        private Builder() {}

        public Builder addFile(String path) {
            this.configFiles.add(path);
            return this;
        }

        public Builder addFiles(List<String> paths) {
            this.configFiles.addAll(paths);
            return this;
        }

        /**
         * Set a single value that takes precedence over every file.
         */
        public Builder withOverride(String path, Object value) {
            this.overrides.put(path, value);
            return this;
        }

        /**
         * Whether to include system properties in resolution.
         * Default: true
         */
        public Builder withSystemProperties(boolean include) {
            this.includeSystemProperties = include;
            return this;
        }

        /**
         * Whether to load application.conf from classpath.
         * Default: true
         */
        public Builder withApplicationConf(boolean include) {
            this.includeApplicationConf = include;
            return this;
        }

        /**
         * Whether to load reference.conf from classpath.
         * Default: true
         */
        public Builder withReferenceConf(boolean include) {
            this.includeReferenceConf = include;
            return this;
        }

        /**
         * Build the merged and resolved configuration.
         *
         * @throws ConfigurationException if a file exists but cannot be parsed
         */
        public Config build() {
            Config config = ConfigFactory.empty();

            if (includeReferenceConf) {
                config = config.withFallback(ConfigFactory.defaultReference());
            }
            if (includeApplicationConf) {
                config = ConfigFactory.defaultApplication().withFallback(config);
            }

            for (String filePath : configFiles) {
                Config fileConfig = loadConfigFile(filePath);
                if (fileConfig != null) {
                    config = fileConfig.withFallback(config);
                    log.info("Loaded config file: {}", filePath);
                }
            }

            if (!overrides.isEmpty()) {
                config = ConfigFactory.parseMap(overrides, "overrides").withFallback(config);
            }
            if (includeSystemProperties) {
                config = ConfigFactory.systemProperties().withFallback(config);
            }

            return config.resolve();
        }

        private Config loadConfigFile(String path) {
            File file = new File(path);
            if (file.exists()) {
                try {
                    return ConfigFactory.parseFile(file, ConfigParseOptions.defaults());
                } catch (Exception e) {
                    log.error("Failed to parse config file: {}", path, e);
                    throw new ConfigurationException("Failed to parse config file: " + path, e);
                }
            }
            Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
            if (!classpathConfig.isEmpty()) {
                return classpathConfig;
            }
            log.warn("Config file not found: {}", path);
            return null;
        }
    }

    /**
     * Exception thrown when configuration loading fails.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
