package io.daqflow.standalone.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * Points compiler logging at stderr, so a program printed to stdout stays clean.
 *
 * <p>Text mode prints a compact {@code LEVEL message} line; at DEBUG and TRACE it switches to
 * {@link #VERBOSE_TEXT_PATTERN}, which adds a timestamp and the logger name. JSON mode uses
 * Logback's {@link JsonEncoder}. Library loggers in {@link #LIBRARY_LOGGERS} stay at WARN unless
 * the requested level is already WARN or quieter.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    static final String TEXT_PATTERN = "%-5level %msg%n";

    static final String VERBOSE_TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    /** Schema validation and YAML parsing internals. */
    static final List<String> LIBRARY_LOGGERS = List.of("com.networknt", "org.yaml.snakeyaml");

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root logger's appenders with a single stderr appender.
     *
     * @param format "json" or "text"
     * @param level  root level name; unknown names fall back to INFO
     * @return the started appender
     */
    public static ConsoleAppender<ILoggingEvent> configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootLevel = Level.toLevel(level, Level.INFO);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(rootLevel);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, format, rootLevel));
        appender.start();
        root.addAppender(appender);

        Level libraryLevel = rootLevel.isGreaterOrEqual(Level.WARN) ? null : Level.WARN;
        LIBRARY_LOGGERS.forEach(name -> context.getLogger(name).setLevel(libraryLevel));
        return appender;
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format, Level rootLevel) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(Level.DEBUG.isGreaterOrEqual(rootLevel) ? VERBOSE_TEXT_PATTERN : TEXT_PATTERN);
        text.start();
        return text;
    }
}
