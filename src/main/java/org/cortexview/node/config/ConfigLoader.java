package org.cortexview.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration, read once at startup. Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file: the one passed explicitly, else {@code cortexview.conf} in the
 *       working directory if present</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions such as {@code ${?REDIS_URL}} are resolved against the merged result.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "cortexview.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code cortexview.conf} from the working directory, if present.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configuration cannot be parsed or resolved.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile A configuration file that must exist, or null to look for
     *                     {@code cortexview.conf} in the working directory.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the explicit file does not exist or the configuration
     *                                  cannot be parsed or resolved.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file: {}", explicitFile.getAbsolutePath());
            fileConfig = parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Using configuration file found in current directory: {}", cwdFile.getAbsolutePath());
                fileConfig = parseFile(cwdFile);
            } else {
                LOG.debug("No '{}' in the working directory, using defaults and environment.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }
        return merge(fileConfig);
    }

    /**
     * Merges the given file-level configuration with the other sources and resolves it.
     *
     * @param fileConfig The file-level configuration.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the merged configuration cannot be resolved.
     */
    public static Config merge(final Config fileConfig) {
        try {
            return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to resolve configuration: " + e.getMessage(), e);
        }
    }

    private static Config parseFile(final File file) {
        try {
            return ConfigFactory.parseFile(file);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to parse configuration file " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
