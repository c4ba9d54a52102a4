package io.inlinerepl.cli.config;

import io.inlinerepl.core.engine.cache.CacheSettings;
import io.inlinerepl.core.model.LogLevel;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import java.time.Duration;
import java.util.Objects;

/**
 * Root configuration of the command-line runner.
 *
 * @param showTopLevelResults    capture stray top-level expressions
 * @param loopProtection         guard loops
 * @param magicComments          honour {@code //?} markers
 * @param showUndefined          print lone {@code undefined} values
 * @param internalLogLevel       internal log level of the transform
 * @param language               dialect of the script
 * @param cacheMaxSize           transpile cache capacity
 * @param cacheTtlMs             transpile cache entry lifetime
 * @param cacheSaveDebounceMs    quiet period before a snapshot write
 * @param cacheCleanupIntervalMs period of the expiry sweep, 0 disables it
 * @param cacheStoreDir          snapshot directory, or {@code null} for a memory-only cache
 * @param outputFormat           {@code text} or {@code json}
 * @param loggingFormat          {@code text} or {@code json}
 * @param loggingLevel           root log level
 */
public record CliConfig(
        boolean showTopLevelResults,
        boolean loopProtection,
        boolean magicComments,
        boolean showUndefined,
        LogLevel internalLogLevel,
        SourceProgram.Language language,
        int cacheMaxSize,
        long cacheTtlMs,
        long cacheSaveDebounceMs,
        long cacheCleanupIntervalMs,
        String cacheStoreDir,
        String outputFormat,
        String loggingFormat,
        String loggingLevel) {

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";

    public CliConfig {
        Objects.requireNonNull(internalLogLevel, "internalLogLevel must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (!FORMAT_TEXT.equals(outputFormat) && !FORMAT_JSON.equals(outputFormat)) {
            throw new ConfigLoadException("output.format must be 'text' or 'json', got: " + outputFormat);
        }
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .showTopLevelResults(showTopLevelResults)
                .loopProtection(loopProtection)
                .magicComments(magicComments)
                .showUndefined(showUndefined)
                .internalLogLevel(internalLogLevel)
                .language(language)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtlMs(cacheTtlMs)
                .cacheSaveDebounceMs(cacheSaveDebounceMs)
                .cacheCleanupIntervalMs(cacheCleanupIntervalMs)
                .cacheStoreDir(cacheStoreDir)
                .outputFormat(outputFormat)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    public TransformOptions transformOptions() {
        return TransformOptions.builder()
                .showTopLevelResults(showTopLevelResults)
                .loopProtection(loopProtection)
                .magicComments(magicComments)
                .showUndefined(showUndefined)
                .internalLogLevel(internalLogLevel)
                .build();
    }

    /**
     * @throws ConfigLoadException if a cache value is out of range
     */
    public CacheSettings cacheSettings() {
        try {
            return new CacheSettings(
                    cacheMaxSize,
                    Duration.ofMillis(cacheTtlMs),
                    Duration.ofMillis(cacheSaveDebounceMs),
                    Duration.ofMillis(cacheCleanupIntervalMs));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid cache configuration: " + e.getMessage(), e);
        }
    }

    public boolean persistentCache() {
        return cacheStoreDir != null && !cacheStoreDir.isBlank();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private boolean showTopLevelResults = true;
        private boolean loopProtection = false;
        private boolean magicComments = false;
        private boolean showUndefined = false;
        private LogLevel internalLogLevel = LogLevel.NONE;
        private SourceProgram.Language language = SourceProgram.Language.JAVASCRIPT;
        private int cacheMaxSize = 100;
        private long cacheTtlMs = 86_400_000L;
        private long cacheSaveDebounceMs = 1_000L;
        private long cacheCleanupIntervalMs = 600_000L;
        private String cacheStoreDir = ".inline-repl";
        private String outputFormat = FORMAT_TEXT;
        private String loggingFormat = FORMAT_TEXT;
        private String loggingLevel = "WARN";

        private Builder() {}

        public Builder showTopLevelResults(boolean showTopLevelResults) {
            this.showTopLevelResults = showTopLevelResults;
            return this;
        }

        public Builder loopProtection(boolean loopProtection) {
            this.loopProtection = loopProtection;
            return this;
        }

        public Builder magicComments(boolean magicComments) {
            this.magicComments = magicComments;
            return this;
        }

        public Builder showUndefined(boolean showUndefined) {
            this.showUndefined = showUndefined;
            return this;
        }

        public Builder internalLogLevel(LogLevel internalLogLevel) {
            this.internalLogLevel = internalLogLevel;
            return this;
        }

        public Builder language(SourceProgram.Language language) {
            this.language = language;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtlMs(long cacheTtlMs) {
            this.cacheTtlMs = cacheTtlMs;
            return this;
        }

        public Builder cacheSaveDebounceMs(long cacheSaveDebounceMs) {
            this.cacheSaveDebounceMs = cacheSaveDebounceMs;
            return this;
        }

        public Builder cacheCleanupIntervalMs(long cacheCleanupIntervalMs) {
            this.cacheCleanupIntervalMs = cacheCleanupIntervalMs;
            return this;
        }

        public Builder cacheStoreDir(String cacheStoreDir) {
            this.cacheStoreDir = cacheStoreDir;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    showTopLevelResults,
                    loopProtection,
                    magicComments,
                    showUndefined,
                    internalLogLevel,
                    language,
                    cacheMaxSize,
                    cacheTtlMs,
                    cacheSaveDebounceMs,
                    cacheCleanupIntervalMs,
                    cacheStoreDir,
                    outputFormat,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
