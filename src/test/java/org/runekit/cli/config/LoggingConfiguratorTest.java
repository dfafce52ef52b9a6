package org.runekit.cli.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("com.example.quoted").setLevel(null);
        context.getLogger("com.example.nested").setLevel(null);
    }

    @Test
    void appliesRootAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = "WARN"
                  levels {
                    "com.example.quoted" = "TRACE"
                    com.example.nested = "ERROR"
                  }
                }
                """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger("com.example.quoted").getLevel()).isEqualTo(Level.TRACE);
        assertThat(context.getLogger("com.example.nested").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void unknownLevelFallsBackToDebug() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"com.example.quoted\" = \"LOUD\" }"));

        assertThat(context.getLogger("com.example.quoted").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void missingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }
}
