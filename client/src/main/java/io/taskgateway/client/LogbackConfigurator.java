package io.taskgateway.client;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON vs. text logging.
 *
 * <p>
 * Called by {@link TaskGatewayMain} after config is loaded. Reconfigures the
 * root logger's appender and level from {@code logging.format} and
 * {@code logging.level}. Log output goes to stderr so that stdout carries only
 * the command result.
 *
 * <p>
 * JSON mode uses Logback 1.5's built-in {@link JsonEncoder}. Text mode uses a
 * human-readable pattern.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Configures the Logback root logger.
     *
     * @param format "json" for structured JSON output, anything else for the
     *               text pattern
     * @param level  log level (TRACE, DEBUG, INFO, WARN, ERROR); unknown values
     *               fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Level resolved = Level.toLevel(level, Level.INFO);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoderFor(format, context));
        appender.start();

        rootLogger.detachAndStopAllAppenders();
        rootLogger.setLevel(resolved);
        rootLogger.addAppender(appender);

        if (level != null && !resolved.levelStr.equalsIgnoreCase(level.trim())) {
            rootLogger.warn("Unknown logging.level '{}', using {}", level, resolved);
        }
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
