package org.resmover.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   level = "WARN"
 *   loggers { "org.resmover.document" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("logging.level"), Level.WARN));
        }

        if (config.hasPath("logging.loggers")) {
            Config loggers = config.getConfig("logging.loggers");
            for (Map.Entry<String, ConfigValue> entry : loggers.root().entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }
}
