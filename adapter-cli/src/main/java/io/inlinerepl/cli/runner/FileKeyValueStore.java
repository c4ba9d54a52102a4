package io.inlinerepl.cli.runner;

import io.inlinerepl.core.spi.KeyValueStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueStore} keeping one file per key, {@code <dir>/<key>.json}. Writes go to a
 * temporary file in the same directory that is then moved over the target, so readers never see a
 * partial value.
 */
public final class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileKeyValueStore.class);
    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    public FileKeyValueStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public String get(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, key, ".tmp");
            try {
                Files.writeString(tmp, value, StandardCharsets.UTF_8);
                move(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
            LOG.debug("store.written key={} bytes={}", key, value.length());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    @Override
    public void remove(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + file, e);
        }
    }

    private Path fileFor(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid store key: " + key);
        }
        return directory.resolve(key + ".json");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
