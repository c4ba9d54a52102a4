package io.inlinerepl.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.inlinerepl.core.model.RunOutcome;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Verifies the key=value log lines and the run id carried in the MDC. */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private ListAppender<ILoggingEvent> appender;
    private Logger engineLogger;
    private Level previousLevel;
    private ReplEngine engine;

    @BeforeEach
    void setUp() {
        engineLogger = (Logger) LoggerFactory.getLogger(ReplEngine.class);
        previousLevel = engineLogger.getLevel();
        engineLogger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        engineLogger.addAppender(appender);
        engine = ReplEngine.builder().build();
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(appender);
        engineLogger.setLevel(previousLevel);
        engine.close();
    }

    private RunOutcome evaluate(String source) {
        return engine.evaluate(SourceProgram.javascript(source), TransformOptions.DEFAULTS, r -> {});
    }

    @Test
    void runCompletionIsLoggedAtInfoWithRunIdInMdc() {
        RunOutcome outcome = evaluate("1");

        assertThat(appender.list)
                .filteredOn(e -> e.getFormattedMessage().startsWith("run.completed"))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.INFO);
                    assertThat(e.getFormattedMessage())
                            .contains("run_id=" + outcome.runId())
                            .contains("state=COMPLETED")
                            .contains("results=1");
                    assertThat(e.getMDCPropertyMap()).containsEntry(ReplEngine.MDC_RUN_ID, outcome.runId());
                });
    }

    @Test
    void transformLogsCacheHitFlag() {
        evaluate("2");
        evaluate("2");

        assertThat(appender.list)
                .filteredOn(e -> e.getFormattedMessage().startsWith("transform.completed"))
                .extracting(ILoggingEvent::getFormattedMessage)
                .hasSize(2)
                .anySatisfy(m -> assertThat(m).contains("cache_hit=false"))
                .anySatisfy(m -> assertThat(m).contains("cache_hit=true"));
    }

    @Test
    void transformFailureIsLogged() {
        evaluate("let = ;");

        assertThat(appender.list)
                .filteredOn(e -> e.getFormattedMessage().startsWith("transform.failed"))
                .singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).contains("category=SYNTAX"));
    }
}
