package io.inlinerepl.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.inlinerepl.core.model.LogLevel;
import io.inlinerepl.core.model.SourceProgram;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML keys are mapped to {@link CliConfig} fields using Jackson YAML. Missing keys receive the
 * defaults from {@link CliConfig.Builder}. Every key can be overridden by an environment
 * variable; env vars take precedence over YAML values. An env var is considered "set" if and only
 * if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    public static final String DEFAULT_CONFIG_FILE = "inline-repl.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying environment variable overrides
     * from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying environment variable overrides
     * from the supplied lookup function. Returning {@code null} from {@code envLookup} means the
     * variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return map(root == null ? MissingNode.getInstance() : root, envLookup, configPath.toString());
    }

    /**
     * Resolves the effective configuration: an explicit {@code --config} file must exist, the
     * default {@value #DEFAULT_CONFIG_FILE} is optional and built-in defaults apply without it.
     *
     * @param explicitPath path given on the command line, or {@code null}
     */
    public static CliConfig resolve(Path explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path defaultPath = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return map(MissingNode.getInstance(), envLookup, "defaults");
    }

    private static CliConfig map(JsonNode root, Function<String, String> envLookup, String origin) {
        try {
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from " + origin + ": " + e.getMessage(), e);
        }
    }

    /** Maps a parsed YAML tree to a {@link CliConfig}, then overlays environment variables. */
    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        JsonNode transform = root.path("transform");
        if (transform.has("show-top-level-results"))
            builder.showTopLevelResults(transform.get("show-top-level-results").asBoolean());
        if (transform.has("loop-protection"))
            builder.loopProtection(transform.get("loop-protection").asBoolean());
        if (transform.has("magic-comments"))
            builder.magicComments(transform.get("magic-comments").asBoolean());
        if (transform.has("show-undefined"))
            builder.showUndefined(transform.get("show-undefined").asBoolean());
        if (transform.has("internal-log-level"))
            builder.internalLogLevel(LogLevel.fromString(transform.get("internal-log-level").asText()));
        if (transform.has("language"))
            builder.language(SourceProgram.Language.fromString(transform.get("language").asText()));

        JsonNode cache = root.path("cache");
        if (cache.has("max-size")) builder.cacheMaxSize(cache.get("max-size").asInt());
        if (cache.has("ttl-ms")) builder.cacheTtlMs(cache.get("ttl-ms").asLong());
        if (cache.has("save-debounce-ms"))
            builder.cacheSaveDebounceMs(cache.get("save-debounce-ms").asLong());
        if (cache.has("cleanup-interval-ms"))
            builder.cacheCleanupIntervalMs(cache.get("cleanup-interval-ms").asLong());
        if (cache.has("store-dir")) builder.cacheStoreDir(textOrNull(cache, "store-dir"));

        JsonNode output = root.path("output");
        if (output.has("format")) builder.outputFormat(lower(output.get("format").asText()));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(lower(logging.get("format").asText()));
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envBool(envLookup, "REPL_SHOW_TOP_LEVEL_RESULTS", builder::showTopLevelResults);
        envBool(envLookup, "REPL_LOOP_PROTECTION", builder::loopProtection);
        envBool(envLookup, "REPL_MAGIC_COMMENTS", builder::magicComments);
        envBool(envLookup, "REPL_SHOW_UNDEFINED", builder::showUndefined);
        envString(envLookup, "REPL_INTERNAL_LOG_LEVEL", v -> builder.internalLogLevel(LogLevel.fromString(v)));
        envString(envLookup, "REPL_LANGUAGE", v -> builder.language(SourceProgram.Language.fromString(v)));

        envInt(envLookup, "REPL_CACHE_MAX_SIZE", builder::cacheMaxSize);
        envLong(envLookup, "REPL_CACHE_TTL_MS", builder::cacheTtlMs);
        envLong(envLookup, "REPL_CACHE_SAVE_DEBOUNCE_MS", builder::cacheSaveDebounceMs);
        envLong(envLookup, "REPL_CACHE_CLEANUP_INTERVAL_MS", builder::cacheCleanupIntervalMs);
        envString(envLookup, "REPL_CACHE_STORE_DIR", builder::cacheStoreDir);

        envString(envLookup, "REPL_OUTPUT_FORMAT", v -> builder.outputFormat(lower(v)));
        envString(envLookup, "LOG_FORMAT", v -> builder.loggingFormat(lower(v)));
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Long.parseLong(envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
