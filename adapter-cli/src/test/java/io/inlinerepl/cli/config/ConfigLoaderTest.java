package io.inlinerepl.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.inlinerepl.core.engine.cache.CacheSettings;
import io.inlinerepl.core.model.LogLevel;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing: key mapping, defaults for missing keys and
 * descriptive errors.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    private static CliConfig loadWithoutEnv(Path path) {
        return ConfigLoader.load(path, Map.<String, String>of()::get);
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Load minimal config → explicit value + all defaults")
        void explicitValueAndDefaults() throws Exception {
            CliConfig config = loadWithoutEnv(fixture("config/minimal-config.yaml"));

            assertThat(config.loopProtection()).isTrue();

            assertThat(config.showTopLevelResults()).isTrue();
            assertThat(config.magicComments()).isFalse();
            assertThat(config.showUndefined()).isFalse();
            assertThat(config.internalLogLevel()).isEqualTo(LogLevel.NONE);
            assertThat(config.language()).isEqualTo(SourceProgram.Language.JAVASCRIPT);
            assertThat(config.cacheMaxSize()).isEqualTo(100);
            assertThat(config.cacheTtlMs()).isEqualTo(86_400_000L);
            assertThat(config.cacheSaveDebounceMs()).isEqualTo(1_000L);
            assertThat(config.cacheCleanupIntervalMs()).isEqualTo(600_000L);
            assertThat(config.cacheStoreDir()).isEqualTo(".inline-repl");
            assertThat(config.outputFormat()).isEqualTo("text");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        void defaultCacheSettingsMatchEngineDefaults() throws Exception {
            CliConfig config = loadWithoutEnv(fixture("config/minimal-config.yaml"));

            assertThat(config.cacheSettings()).isEqualTo(CacheSettings.DEFAULTS);
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Load full config → all fields populated")
        void allFieldsPopulated() throws Exception {
            CliConfig config = loadWithoutEnv(fixture("config/full-config.yaml"));

            assertThat(config.showTopLevelResults()).isFalse();
            assertThat(config.loopProtection()).isTrue();
            assertThat(config.magicComments()).isTrue();
            assertThat(config.showUndefined()).isTrue();
            assertThat(config.internalLogLevel()).isEqualTo(LogLevel.DEBUG);
            assertThat(config.language()).isEqualTo(SourceProgram.Language.TYPESCRIPT);
            assertThat(config.cacheStoreDir()).isEqualTo("/var/cache/inline-repl");
            assertThat(config.outputFormat()).isEqualTo("json");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        void derivesTransformOptionsAndCacheSettings() throws Exception {
            CliConfig config = loadWithoutEnv(fixture("config/full-config.yaml"));

            TransformOptions options = config.transformOptions();
            assertThat(options.showTopLevelResults()).isFalse();
            assertThat(options.magicComments()).isTrue();
            assertThat(options.internalLogLevel()).isEqualTo(LogLevel.DEBUG);

            CacheSettings settings = config.cacheSettings();
            assertThat(settings.maxSize()).isEqualTo(25);
            assertThat(settings.ttl()).isEqualTo(Duration.ofHours(1));
            assertThat(settings.saveDebounce()).isEqualTo(Duration.ofMillis(250));
            assertThat(settings.cleanupInterval()).isZero();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingExplicitFileIsDescriptive() {
            Path missing = Path.of("does-not-exist.yaml");

            assertThatThrownBy(() -> loadWithoutEnv(missing))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("--config");
        }

        @Test
        void invalidYamlIsWrapped(@TempDir Path dir) throws Exception {
            Path broken = dir.resolve("broken.yaml");
            Files.writeString(broken, "transform: [unclosed\n  - : :");

            assertThatThrownBy(() -> loadWithoutEnv(broken))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration");
        }

        @Test
        void unknownOutputFormatIsRejected() throws Exception {
            assertThatThrownBy(() -> loadWithoutEnv(fixture("config/bad-output-format.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("output.format");
        }

        @Test
        void unknownInternalLogLevelIsRejected(@TempDir Path dir) throws Exception {
            Path config = dir.resolve("levels.yaml");
            Files.writeString(config, "transform:\n  internal-log-level: loud\n");

            assertThatThrownBy(() -> loadWithoutEnv(config))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("loud");
        }

        @Test
        void nonPositiveCacheSizeIsRejectedWhenBuildingSettings(@TempDir Path dir) throws Exception {
            Path config = dir.resolve("cache.yaml");
            Files.writeString(config, "cache:\n  max-size: 0\n");

            CliConfig loaded = loadWithoutEnv(config);

            assertThatThrownBy(loaded::cacheSettings)
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("maxSize");
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        void emptyFileMeansDefaults(@TempDir Path dir) throws Exception {
            Path empty = dir.resolve("empty.yaml");
            Files.writeString(empty, "");

            assertThat(loadWithoutEnv(empty)).isEqualTo(CliConfig.builder().build());
        }

        @Test
        void explicitPathMustExist() {
            assertThatThrownBy(() -> ConfigLoader.resolve(Path.of("nope.yaml"), name -> null))
                    .isInstanceOf(ConfigLoadException.class);
        }

        @Test
        void noExplicitPathAndNoDefaultFileMeansDefaults() {
            CliConfig config = ConfigLoader.resolve(null, Map.of("REPL_MAGIC_COMMENTS", "true")::get);

            assertThat(config.magicComments()).isTrue();
            assertThat(config.loopProtection()).isFalse();
        }
    }
}
