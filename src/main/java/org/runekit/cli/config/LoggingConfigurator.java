package org.runekit.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.runekit.overlay.protocol" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and the per-logger levels. Unknown level names fall back to
     * {@code DEBUG}, Logback's default for unparseable levels.
     *
     * @param config the resolved application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            // Leaf paths cover both "org.runekit" = X and org.runekit = X.
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level));
            }
        }
    }
}
