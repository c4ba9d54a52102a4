package io.inlinerepl.cli.runner;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.inlinerepl.core.model.CacheStats;
import io.inlinerepl.core.model.Color;
import io.inlinerepl.core.model.ColoredElement;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOutcome;
import io.inlinerepl.core.model.RunState;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResultPrinter} text and JSON-lines output. */
class ResultPrinterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    private static final ExecutionResult ARRAY_RESULT = ExecutionResult.execution(
            3,
            ColoredElement.composite(
                    null,
                    ColoredElement.leaf("["),
                    ColoredElement.leaf("1", Color.NUMBER),
                    ColoredElement.leaf(", "),
                    ColoredElement.leaf("2", Color.NUMBER),
                    ColoredElement.leaf("]")));

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String[] lines() {
        return buffer.toString(StandardCharsets.UTF_8).split("\\R");
    }

    @Nested
    @DisplayName("Text format")
    class TextFormat {

        @Test
        void prefixesLineNumbers() {
            ResultPrinter printer = new ResultPrinter(out, "text");

            printer.print(ARRAY_RESULT);
            printer.print(ExecutionResult.execution(null, ColoredElement.leaf("host output")));
            printer.print(ExecutionResult.error("boom"));

            assertThat(lines()).containsExactly("3: [1, 2]", "host output", "error: boom");
        }

        @Test
        void outcomeIsSilent() {
            new ResultPrinter(out, "text").printOutcome(new RunOutcome("run-1", RunState.COMPLETED, 0, null, 3));

            assertThat(buffer.size()).isZero();
        }

        @Test
        void statsOnOneLine() {
            new ResultPrinter(out, "text").printStats(new CacheStats(2, 3, 1, 75, 640));

            assertThat(lines()).containsExactly("cache: size=2 hits=3 misses=1 hit_rate=75% memory_bytes=640");
        }
    }

    @Nested
    @DisplayName("JSON format")
    class JsonFormat {

        @Test
        void resultCarriesSegmentsWithColors() throws Exception {
            new ResultPrinter(out, "json").print(ARRAY_RESULT);

            JsonNode node = MAPPER.readTree(lines()[0]);
            assertThat(node.get("type").asText()).isEqualTo("result");
            assertThat(node.get("kind").asText()).isEqualTo("execution");
            assertThat(node.get("line").asInt()).isEqualTo(3);
            assertThat(node.get("text").asText()).isEqualTo("[1, 2]");
            assertThat(node.get("segments")).hasSize(5);
            assertThat(node.get("segments").get(1).get("color").asText()).isEqualTo("NUMBER");
            assertThat(node.get("segments").get(1).get("hex").asText()).isEqualTo("#368aa3");
            assertThat(node.get("segments").get(0).has("color")).isFalse();
        }

        @Test
        void errorHasNullLine() throws Exception {
            new ResultPrinter(out, "json").print(ExecutionResult.error("Loop limit exceeded"));

            JsonNode node = MAPPER.readTree(lines()[0]);
            assertThat(node.get("kind").asText()).isEqualTo("error");
            assertThat(node.get("line").isNull()).isTrue();
        }

        @Test
        void outcomeAndStatsAreTyped() throws Exception {
            ResultPrinter printer = new ResultPrinter(out, "json");

            printer.printOutcome(new RunOutcome("run-4", RunState.FAILED, 1, ErrorCategory.LOOP_LIMIT, 12));
            printer.printStats(new CacheStats(1, 0, 1, 0, 300));

            JsonNode outcome = MAPPER.readTree(lines()[0]);
            assertThat(outcome.get("type").asText()).isEqualTo("outcome");
            assertThat(outcome.get("state").asText()).isEqualTo("FAILED");
            assertThat(outcome.get("errorCategory").asText()).isEqualTo("LOOP_LIMIT");

            JsonNode stats = MAPPER.readTree(lines()[1]);
            assertThat(stats.get("type").asText()).isEqualTo("stats");
            assertThat(stats.get("cache").get("misses").asLong()).isEqualTo(1);
            assertThat(stats.get("cache").get("memoryBytes").asLong()).isEqualTo(300);
        }

        @Test
        void instrumentedCodeIsWrapped() throws Exception {
            new ResultPrinter(out, "json").printInstrumented("__debug(1, 2);\n");

            JsonNode node = MAPPER.readTree(lines()[0]);
            assertThat(node.get("code").asText()).isEqualTo("__debug(1, 2);\n");
        }
    }
}
