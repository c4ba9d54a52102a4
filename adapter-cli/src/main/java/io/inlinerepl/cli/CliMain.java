package io.inlinerepl.cli;

import io.inlinerepl.cli.config.CliConfig;
import io.inlinerepl.cli.config.ConfigLoader;
import io.inlinerepl.cli.runner.CliArguments;
import io.inlinerepl.cli.runner.FileKeyValueStore;
import io.inlinerepl.cli.runner.LogbackConfigurator;
import io.inlinerepl.cli.runner.ResultPrinter;
import io.inlinerepl.core.engine.ReplEngine;
import io.inlinerepl.core.engine.RunHandle;
import io.inlinerepl.core.engine.cache.TranspileCache;
import io.inlinerepl.core.error.TransformFailureException;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOutcome;
import io.inlinerepl.core.model.SourceProgram;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: instruments a script, runs it and prints every captured value.
 *
 * <p>
 * Exit codes: 0 when the run completed, 2 when it failed or was cancelled, 1 when the runner could
 * not start (bad arguments, configuration or unreadable script). Interrupting the process cancels
 * the run and waits briefly for its cancellation result.
 */
public final class CliMain {

    private static final Logger LOG = LoggerFactory.getLogger(CliMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILURE = 1;
    public static final int EXIT_RUN_FAILED = 2;

    private static final long CANCEL_GRACE_MS = 2_000;

    private CliMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, see {@link CliArguments#USAGE}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            CliArguments arguments = CliArguments.parse(args);
            CliConfig config = ConfigLoader.resolve(arguments.configPath(), System::getenv);
            LogbackConfigurator.configure(config);
            status = execute(arguments, config, System.in, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one script with an already loaded configuration. Command-line flags override the
     * configuration.
     *
     * @return the process exit code
     * @throws IOException if the script cannot be read
     */
    public static int execute(CliArguments arguments, CliConfig config, InputStream stdin, PrintStream out)
            throws IOException {
        CliConfig effective = applyFlags(arguments, config);
        SourceProgram program = new SourceProgram(readScript(arguments, stdin), effective.language());
        ResultPrinter printer = new ResultPrinter(out, effective.outputFormat());

        try (TranspileCache cache = new TranspileCache(
                        effective.cacheSettings(),
                        effective.persistentCache() ? new FileKeyValueStore(Path.of(effective.cacheStoreDir())) : null);
                ReplEngine engine = ReplEngine.builder().cache(cache).build()) {
            int status = arguments.transformOnly()
                    ? transformOnly(engine, program, effective, printer)
                    : run(engine, program, effective, printer);
            if (arguments.stats()) {
                printer.printStats(engine.cacheStats());
            }
            return status;
        }
    }

    static CliConfig applyFlags(CliArguments arguments, CliConfig config) {
        CliConfig.Builder builder = config.toBuilder();
        if (arguments.loopProtection()) {
            builder.loopProtection(true);
        }
        if (arguments.magicComments()) {
            builder.magicComments(true);
        }
        return builder.build();
    }

    private static int transformOnly(ReplEngine engine, SourceProgram program, CliConfig config, ResultPrinter printer) {
        try {
            printer.printInstrumented(engine.transform(program, config.transformOptions()));
            return EXIT_OK;
        } catch (TransformFailureException e) {
            printer.print(ExecutionResult.error(e.getMessage()));
            return EXIT_RUN_FAILED;
        }
    }

    private static int run(ReplEngine engine, SourceProgram program, CliConfig config, ResultPrinter printer) {
        RunHandle handle = engine.submit(program, config.transformOptions(), printer::print);
        Thread cancelOnShutdown = new Thread(() -> cancelAndWait(handle), "repl-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        try {
            RunOutcome outcome = handle.outcome().join();
            printer.printOutcome(outcome);
            return outcome.completed() ? EXIT_OK : EXIT_RUN_FAILED;
        } finally {
            removeShutdownHook(cancelOnShutdown);
        }
    }

    private static void cancelAndWait(RunHandle handle) {
        if (handle.outcome().isDone()) {
            return;
        }
        LOG.info("run.cancel_requested run_id={}", handle.runId());
        handle.cancel();
        try {
            handle.outcome().get(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("run.cancel_timeout run_id={} grace_ms={}", handle.runId(), CANCEL_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.warn("run.cancel_failed run_id={}", handle.runId(), e);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            LOG.debug("Shutdown in progress, keeping cancel hook");
        }
    }

    private static String readScript(CliArguments arguments, InputStream stdin) throws IOException {
        if (arguments.readsStdin()) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(arguments.script()), StandardCharsets.UTF_8);
    }
}
