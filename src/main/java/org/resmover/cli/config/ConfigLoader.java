package org.resmover.cli.config;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration used by all commands.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dresmover.max-rounds=20})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "resmover.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads it over the classpath defaults.
     * The first of these that applies wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/resmover.conf} in the working directory</li>
     *   <li>{@code config/resmover.conf} in the installation directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the {@code --config} option, or {@code null}.
     * @param handler            receives resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: "
                            + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found in current directory or installation directory. "
                + "Using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
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

    /**
     * Looks for {@code APP_HOME/config/resmover.conf}, where {@code APP_HOME} is the parent of
     * the {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} if it cannot be determined or does not exist.
     */
    private static File detectInstallationConfigFile() {
        try {
            final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
            if (codeSource == null) {
                return null;
            }
            final URL location = codeSource.getLocation();
            final File jar = new File(location.toURI());
            if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
                return null;
            }
            final File configFile = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
            return configFile.exists() ? configFile : null;
        } catch (Exception ignored) {
            // Best-effort detection; the classpath defaults still apply.
            return null;
        }
    }
}
