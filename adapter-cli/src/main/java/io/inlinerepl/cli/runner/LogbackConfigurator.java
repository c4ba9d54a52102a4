package io.inlinerepl.cli.runner;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.inlinerepl.cli.config.CliConfig;
import io.inlinerepl.core.engine.ReplEngine;
import org.slf4j.LoggerFactory;

/**
 * Points Logback at the CLI's diagnostics channel once the configuration is known.
 *
 * <p>
 * Standard output belongs to {@link ResultPrinter}, so every log line goes to standard error. The
 * configured level applies to the engine and CLI loggers under {@value #ENGINE_LOGGER}; any other
 * library stays at WARN unless ERROR was asked for. Each line carries the run id the engine puts
 * in the MDC, as a {@code [run]} column in text mode or as an {@code mdc} field in JSON mode.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";
    static final String ENGINE_LOGGER = "io.inlinerepl";
    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} %-5level [%X{" + ReplEngine.MDC_RUN_ID + ":--}] %logger{0} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the bootstrap appender from {@code logback.xml} with one that honours
     * {@code logging.format} and {@code logging.level}. An unknown level falls back to WARN.
     */
    public static void configure(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level level = Level.toLevel(config.loggingLevel(), Level.WARN);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(level.isGreaterOrEqual(Level.WARN) ? level : Level.WARN);
        context.getLogger(ENGINE_LOGGER).setLevel(level);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoderFor(config.loggingFormat(), context));
        appender.start();
        root.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if (CliConfig.FORMAT_JSON.equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.setWithFormattedMessage(true);
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
