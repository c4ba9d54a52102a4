package io.inlinerepl.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.inlinerepl.core.error.ScriptExecutionException;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOptions;
import io.inlinerepl.core.spi.DebugSink;
import io.inlinerepl.core.spi.ExecutionHost;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.Undefined;

@DisplayName("ExecutionBridge")
class ExecutionBridgeTest {

    private final List<ExecutionResult> results = new ArrayList<>();

    /** Host that replays a script of sink calls instead of running code. */
    private static ExecutionHost scripted(Consumer<DebugSink> script) {
        return new ExecutionHost() {
            @Override
            public void execute(String instrumentedSource, DebugSink sink, BooleanSupplier cancellationRequested) {
                script.accept(sink);
            }
        };
    }

    private ExecutionBridge.Report run(ExecutionHost host, RunOptions options) {
        return new ExecutionBridge(host).execute("ignored", options, results::add, () -> false);
    }

    private List<String> texts() {
        return results.stream().map(r -> r.element().text()).toList();
    }

    @Test
    void deliversValuesWithTheirLines() {
        ExecutionBridge.Report report = run(
                scripted(sink -> {
                    sink.capture(1, List.of(8));
                    sink.capture(2, List.of("x"));
                }),
                RunOptions.DEFAULTS);

        assertThat(report).isEqualTo(new ExecutionBridge.Report(2, null));
        assertThat(results).extracting(ExecutionResult::lineNumber).containsExactly(1, 2);
        assertThat(texts()).containsExactly("8", "\"x\"");
    }

    @Test
    void suppressesLoneUndefinedByDefault() {
        ExecutionHost host = scripted(sink -> {
            sink.capture(1, List.of(Undefined.instance));
            sink.capture(2, List.of());
        });

        run(host, RunOptions.DEFAULTS);
        assertThat(results).isEmpty();

        run(host, new RunOptions(true));
        assertThat(texts()).containsExactly("undefined", "undefined");
    }

    @Test
    void promiseSettlingToUndefinedIsSuppressedByDefault() {
        ExecutionHost host = scripted(sink -> {
            CompletableFuture<Object> settled = new CompletableFuture<>();
            sink.capture(3, List.of(settled));
            settled.complete(Undefined.instance);
        });

        ExecutionBridge.Report report = run(host, RunOptions.DEFAULTS);
        assertThat(report.resultCount()).isZero();
        assertThat(results).isEmpty();

        run(host, new RunOptions(true));
        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.lineNumber()).isEqualTo(3);
            assertThat(r.element().text()).isEqualTo("undefined");
        });
    }

    @Test
    void groupsSeveralValuesIntoOneArrayResult() {
        run(scripted(sink -> sink.capture(4, List.of(1, "two"))), RunOptions.DEFAULTS);

        assertThat(texts()).containsExactly("[1, \"two\"]");
    }

    @Test
    @DisplayName("A thrown error ends the run with exactly one error result")
    void thrownErrorBecomesFinalResult() {
        ExecutionBridge.Report report = run(
                scripted(sink -> {
                    sink.capture(1, List.of(1));
                    throw new ScriptExecutionException("boom", ErrorCategory.RUNTIME);
                }),
                RunOptions.DEFAULTS);

        assertThat(report.errorCategory()).isEqualTo(ErrorCategory.RUNTIME);
        assertThat(report.resultCount()).isEqualTo(2);
        assertThat(results).hasSize(2);
        ExecutionResult last = results.get(1);
        assertThat(last.isError()).isTrue();
        assertThat(last.lineNumber()).isNull();
        assertThat(last.element().text()).isEqualTo("boom");
    }

    @Test
    void nothingIsDeliveredAfterTheError() {
        CompletableFuture<Object> promise = new CompletableFuture<>();
        run(
                scripted(sink -> {
                    sink.capture(1, List.of(promise));
                    throw new ScriptExecutionException(ErrorCategory.CANCELLED_MESSAGE, ErrorCategory.CANCELLED);
                }),
                RunOptions.DEFAULTS);

        promise.complete(5);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).isError()).isTrue();
    }

    @Test
    void unsettledPromisesAreReportedAsPending() {
        run(scripted(sink -> sink.capture(1, List.of(new CompletableFuture<>()))), RunOptions.DEFAULTS);

        assertThat(texts()).containsExactly("Promise { <pending> }");
    }

    @Test
    void resultsFollowSettlementOrderNotLineOrder() {
        CompletableFuture<Object> slow = new CompletableFuture<>();
        run(
                scripted(sink -> {
                    sink.capture(1, List.of(slow));
                    sink.capture(2, List.of("fast"));
                    slow.complete("slow");
                }),
                RunOptions.DEFAULTS);

        assertThat(results).extracting(ExecutionResult::lineNumber).containsExactly(2, 1);
    }

    @Test
    void unserializableValuesAreDropped() {
        Object hostile = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("no");
            }
        };

        ExecutionBridge.Report report =
                run(scripted(sink -> sink.capture(1, List.of(hostile))), RunOptions.DEFAULTS);

        assertThat(report.resultCount()).isZero();
        assertThat(results).isEmpty();
    }

    @Test
    void hostFailuresAreReportedAsRuntimeErrors() {
        ExecutionBridge.Report report = run(
                scripted(sink -> {
                    throw new IllegalStateException("host broke");
                }),
                RunOptions.DEFAULTS);

        assertThat(report.errorCategory()).isEqualTo(ErrorCategory.RUNTIME);
        assertThat(texts()).containsExactly("host broke");
    }

    @Test
    void consumerFailuresDoNotStopTheRun() {
        List<ExecutionResult> seen = new ArrayList<>();
        ExecutionBridge bridge = new ExecutionBridge(scripted(sink -> {
            sink.capture(1, List.of(1));
            sink.capture(2, List.of(2));
        }));

        ExecutionBridge.Report report = bridge.execute(
                "ignored",
                RunOptions.DEFAULTS,
                r -> {
                    seen.add(r);
                    throw new IllegalStateException("consumer");
                },
                () -> false);

        assertThat(seen).hasSize(2);
        assertThat(report.failed()).isFalse();
    }
}
