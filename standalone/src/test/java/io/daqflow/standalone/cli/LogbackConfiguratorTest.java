package io.daqflow.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link LogbackConfigurator}. */
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTestConfiguration() throws Exception {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    private Logger root() {
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void textModeWritesCompactLinesToStderr() {
        ConsoleAppender<ILoggingEvent> appender = LogbackConfigurator.configure("text", "INFO");

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
        assertThat(root().getAppender(LogbackConfigurator.APPENDER_NAME)).isSameAs(appender);
        assertThat(root().iteratorForAppenders()).toIterable().hasSize(1);
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.isStarted()).isTrue();
        assertThat(appender.getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class,
                        encoder -> assertThat(encoder.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    void debugLevelSwitchesToVerbosePattern() {
        ConsoleAppender<ILoggingEvent> appender = LogbackConfigurator.configure("TEXT", "debug");

        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.VERBOSE_TEXT_PATTERN);
    }

    @Test
    void jsonModeUsesJsonEncoder() {
        ConsoleAppender<ILoggingEvent> appender = LogbackConfigurator.configure("json", "WARN");

        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(root().getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void libraryLoggersAreCappedOnlyWhenRootIsMoreVerbose() {
        LogbackConfigurator.configure("text", "DEBUG");
        for (String name : LogbackConfigurator.LIBRARY_LOGGERS) {
            assertThat(context.getLogger(name).getLevel()).isEqualTo(Level.WARN);
        }

        LogbackConfigurator.configure("text", "ERROR");
        for (String name : LogbackConfigurator.LIBRARY_LOGGERS) {
            assertThat(context.getLogger(name).getLevel()).isNull();
            assertThat(context.getLogger(name).getEffectiveLevel()).isEqualTo(Level.ERROR);
        }
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
    }
}
