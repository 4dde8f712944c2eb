package org.pdemeta.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "pdemeta.conf";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration with {@code pdemeta.conf} from the working directory as the file layer.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System properties (e.g. {@code -Dpdemeta.analysis.bound-tolerance=1e-6})
     * 2. Environment variables
     * 3. The given configuration file, skipped when absent
     * 4. Default values from {@code reference.conf} on the classpath
     *
     * @param configFile The file layer, may be {@code null}.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using classpath defaults.", configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
