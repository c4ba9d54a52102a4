package io.inlinerepl.cli.runner;

import java.nio.file.Path;

/**
 * Parsed command line: {@code [--config <path>] [--transform-only] [--stats] [--loop-protection]
 * [--magic-comments] <script | ->}.
 *
 * @param configPath     explicit configuration file, or {@code null}
 * @param transformOnly  print the instrumented code instead of running it
 * @param stats          print cache statistics at the end
 * @param loopProtection force loop protection on
 * @param magicComments  force magic comments on
 * @param script         script path, or {@code -} for standard input
 */
public record CliArguments(
        Path configPath, boolean transformOnly, boolean stats, boolean loopProtection, boolean magicComments, String script) {

    public static final String STDIN = "-";

    public static final String USAGE = "Usage: inline-repl [--config <path>] [--transform-only] [--stats]"
            + " [--loop-protection] [--magic-comments] <script | ->";

    /**
     * @throws IllegalArgumentException for an unknown flag, a missing flag value or a missing or
     *                                  repeated script argument
     */
    public static CliArguments parse(String[] args) {
        Path configPath = null;
        boolean transformOnly = false;
        boolean stats = false;
        boolean loopProtection = false;
        boolean magicComments = false;
        String script = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file path argument");
                    }
                    configPath = Path.of(args[++i]);
                }
                case "--transform-only" -> transformOnly = true;
                case "--stats" -> stats = true;
                case "--loop-protection" -> loopProtection = true;
                case "--magic-comments" -> magicComments = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg + ". " + USAGE);
                    }
                    if (script != null) {
                        throw new IllegalArgumentException("Only one script may be given. " + USAGE);
                    }
                    script = arg;
                }
            }
        }
        if (script == null) {
            throw new IllegalArgumentException("Missing script argument. " + USAGE);
        }
        return new CliArguments(configPath, transformOnly, stats, loopProtection, magicComments, script);
    }

    public boolean readsStdin() {
        return STDIN.equals(script);
    }
}
