package org.runekit.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Resolves the application configuration for the {@code runekit} CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Drunekit.http.port=8080})</li>
 *   <li>Environment variables</li>
 *   <li>One configuration file, found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are merged, so overriding a value in
 * the file also changes every default that refers to it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "runekit.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
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
     * Locates the configuration file and loads it on top of the classpath defaults.
     * <p>
     * The first existing candidate wins:
     * <ol>
     *   <li>the file given with {@code --config};</li>
     *   <li>the file named by {@code -Dconfig.file};</li>
     *   <li>{@code config/runekit.conf} in the working directory;</li>
     *   <li>{@code APP_HOME/config/runekit.conf}, with {@code APP_HOME} inferred from the
     *       location of the application jar.</li>
     * </ol>
     * Without any of them only the classpath defaults are used.
     *
     * @param explicitConfigFile the {@code --config} option, or {@code null}.
     * @param handler            receives progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadExplicit(explicitConfigFile, "--config", handler);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadExplicit(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        File workingDirectoryFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirectoryFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file from working directory: "
                    + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using built-in defaults");
        return loadDefaults();
    }

    private static Config loadExplicit(File file, String source, ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException("Configuration file given via " + source + " not found: "
                    + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given via " + source + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    /**
     * Loads a configuration file merged with the classpath defaults.
     */
    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Loads the classpath defaults with system property and environment overrides.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Looks for {@code config/runekit.conf} next to the {@code lib} directory holding the
     * application jar.
     *
     * @return the file, or {@code null} if it does not exist or the jar location is unknown.
     */
    private static File installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        // APP_HOME/lib/runekit.jar; a classes directory has no installation layout.
        if (!location.isFile() || location.getParentFile() == null) {
            return null;
        }
        File appHome = location.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
