package org.replaystore.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration from layered HOCON sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dreplaystore.tables.replay.maxSize=...})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file chosen by {@link #resolve(File)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference configuration is loaded unresolved so that substitutions in it
 * pick up values overridden by the higher layers.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "replaystore.conf";

    private ConfigLoader() {
    }

    /**
     * Picks the configuration file to load, in this order:
     * <ol>
     *   <li>{@code explicitConfigFile}, if given</li>
     *   <li>the file named by the {@code config.file} system property</li>
     *   <li>{@code config/replaystore.conf} in the working directory</li>
     *   <li>none: classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile configuration file chosen by the caller, or {@code null}
     * @return the fully resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile) {
        if (explicitConfigFile != null) {
            return loadFromFile(requireExists(explicitConfigFile, "explicit configuration file"));
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadFromFile(requireExists(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file"));
        }

        File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            return loadFromFile(cwdConfigFile);
        }

        log.warn("No '{}/{}' found in the working directory, using classpath defaults", CONFIG_DIR, CONFIG_FILE_NAME);
        return loadDefaults();
    }

    /**
     * Loads a configuration file layered between the overrides and the classpath defaults.
     *
     * @param configFile the file to load
     * @return the fully resolved configuration
     */
    static Config loadFromFile(File configFile) {
        log.info("Using configuration file {}", configFile.getAbsolutePath());
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Loads the classpath defaults with system property and environment overrides.
     *
     * @return the fully resolved configuration
     */
    static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment());
    }

    private static File requireExists(File file, String source) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file from " + source + " not found: " + file.getAbsolutePath());
        }
        return file;
    }
}
