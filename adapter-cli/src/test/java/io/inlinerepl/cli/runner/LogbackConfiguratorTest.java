package io.inlinerepl.cli.runner;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import io.inlinerepl.cli.config.CliConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link LogbackConfigurator} routing of diagnostics to standard error. */
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTestConfiguration() throws Exception {
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(getClass().getResource("/logback-test.xml"));
    }

    private static CliConfig config(String format, String level) {
        return CliConfig.builder().loggingFormat(format).loggingLevel(level).build();
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> stderrAppender() {
        Appender<ILoggingEvent> appender =
                context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        return (ConsoleAppender<ILoggingEvent>) appender;
    }

    @Test
    void textModeWritesRunIdColumnToStandardError() {
        LogbackConfigurator.configure(config("text", "INFO"));

        ConsoleAppender<ILoggingEvent> appender = stderrAppender();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.isStarted()).isTrue();
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).contains("%X{runId");
    }

    @Test
    void jsonModeUsesJsonEncoder() {
        LogbackConfigurator.configure(config("JSON", "WARN"));

        assertThat(stderrAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    void verboseLevelAppliesToEngineLoggersOnly() {
        LogbackConfigurator.configure(config("text", "DEBUG"));

        assertThat(context.getLogger(LogbackConfigurator.ENGINE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void errorLevelAlsoQuietsOtherLibraries() {
        LogbackConfigurator.configure(config("text", "ERROR"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void unknownLevelFallsBackToWarn() {
        LogbackConfigurator.configure(config("text", "chatty"));

        assertThat(context.getLogger(LogbackConfigurator.ENGINE_LOGGER).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void reconfiguringReplacesTheAppender() {
        LogbackConfigurator.configure(config("text", "INFO"));
        LogbackConfigurator.configure(config("json", "INFO"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).iteratorForAppenders())
                .toIterable()
                .singleElement()
                .satisfies(a -> assertThat(a.getName()).isEqualTo(LogbackConfigurator.APPENDER_NAME));
    }
}
