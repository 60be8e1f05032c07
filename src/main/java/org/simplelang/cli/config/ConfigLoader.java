package org.simplelang.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file picked up from the working directory when none is given. */
    public static final String CONFIG_FILE_NAME = "simplelang.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dsimplelang.frontend.mode=FIRST_ERROR)
     * 2. Environment Variables
     * 3. Configuration File (the explicit file, else simplelang.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicitly requested configuration file, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if the explicit file is missing or any source
     *         cannot be parsed or resolved.
     */
    public static Config load(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig(configFile))
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
                .resolve();
    }

    private static Config fileConfig(final File configFile) {
        if (configFile != null) {
            LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdConfigFile);
        }
        LOG.debug("No '{}' in the working directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }
}
