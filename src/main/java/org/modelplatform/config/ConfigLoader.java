package org.modelplatform.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the platform configuration.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dmodelplatform.cache.enabled=false})</li>
 *   <li>environment variables</li>
 *   <li>one user configuration file, see {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so a user file can override values
 * that {@code reference.conf} refers to.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "modelplatform.conf";
    static final String USER_DIR = ".modelplatform";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is searched.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration and reports progress through SLF4J.
     */
    public static Config resolve() {
        return resolve(null, ConfigLoader::logMessage);
    }

    /**
     * Resolves the configuration, taking the user file from the first of:
     * <ol>
     *   <li>{@code explicitConfigFile}</li>
     *   <li>the {@code config.file} system property</li>
     *   <li>{@code config/modelplatform.conf} in the working directory</li>
     *   <li>{@code ~/.modelplatform/modelplatform.conf}</li>
     * </ol>
     * Without any of them only classpath defaults apply.
     *
     * @param explicitConfigFile file chosen by the caller, or null for discovery
     * @param handler            receives progress messages
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: "
                        + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via -Dconfig.file not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: "
                    + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file found in current directory: "
                    + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        File userConfigFile = new File(new File(System.getProperty("user.home", "."), USER_DIR), CONFIG_FILE_NAME);
        if (userConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file from home directory: "
                    + userConfigFile.getAbsolutePath());
            return loadFromFile(userConfigFile);
        }

        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found; using default configuration from classpath");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static void logMessage(MessageLevel level, String message) {
        if (level == MessageLevel.WARN) {
            log.warn(message);
        } else {
            log.debug(message);
        }
    }
}
