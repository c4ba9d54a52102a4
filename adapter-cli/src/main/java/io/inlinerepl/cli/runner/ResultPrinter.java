package io.inlinerepl.cli.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.inlinerepl.cli.config.CliConfig;
import io.inlinerepl.core.model.CacheStats;
import io.inlinerepl.core.model.ColoredElement;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOutcome;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes results to standard output, either as plain lines ({@code 3: [1, 2]}) or as one JSON
 * object per line.
 *
 * <p>
 * JSON result lines look like
 * {@code {"type":"result","kind":"execution","line":3,"text":"[1, 2]","segments":[...]}} where
 * each segment carries its text and, when colored, the color name and hex value.
 */
public final class ResultPrinter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PrintStream out;
    private final boolean json;

    public ResultPrinter(PrintStream out, String format) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.json = CliConfig.FORMAT_JSON.equals(format);
    }

    public synchronized void print(ExecutionResult result) {
        if (json) {
            out.println(write(toJson(result)));
        } else if (result.isError()) {
            out.println("error: " + result.element().text());
        } else if (result.lineNumber() == null) {
            out.println(result.element().text());
        } else {
            out.println(result.lineNumber() + ": " + result.element().text());
        }
        out.flush();
    }

    /** Prints instrumented source produced by a transform-only invocation. */
    public synchronized void printInstrumented(String code) {
        if (json) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", "instrumented");
            node.put("code", code);
            out.println(write(node));
        } else {
            out.println(code);
        }
        out.flush();
    }

    public synchronized void printOutcome(RunOutcome outcome) {
        if (!json) {
            return;
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "outcome");
        node.put("runId", outcome.runId());
        node.put("state", outcome.state().name());
        node.put("results", outcome.resultCount());
        if (outcome.errorCategory() != null) {
            node.put("errorCategory", outcome.errorCategory().name());
        }
        node.put("durationMs", outcome.durationMs());
        out.println(write(node));
        out.flush();
    }

    public synchronized void printStats(CacheStats stats) {
        if (json) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", "stats");
            node.set("cache", MAPPER.valueToTree(stats));
            out.println(write(node));
        } else {
            out.println(String.format(
                    Locale.ROOT,
                    "cache: size=%d hits=%d misses=%d hit_rate=%d%% memory_bytes=%d",
                    stats.size(),
                    stats.hits(),
                    stats.misses(),
                    stats.hitRate(),
                    stats.memoryBytes()));
        }
        out.flush();
    }

    private static ObjectNode toJson(ExecutionResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "result");
        node.put("kind", result.kind().name().toLowerCase(Locale.ROOT));
        if (result.lineNumber() == null) {
            node.putNull("line");
        } else {
            node.put("line", result.lineNumber());
        }
        node.put("text", result.element().text());
        ArrayNode segments = node.putArray("segments");
        for (ColoredElement.Leaf leaf : result.element().flatten()) {
            ObjectNode segment = segments.addObject();
            segment.put("text", leaf.content());
            if (leaf.color() != null) {
                segment.put("color", leaf.color().name());
                segment.put("hex", leaf.color().hex());
            }
        }
        return node;
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
