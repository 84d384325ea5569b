package com.notegraph.core.service.persistence.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * BytesStore backed by a single file.
 *
 * Content is written to a sibling temp file and moved over the target, so readers
 * never see a half-written snapshot.
 */
@Slf4j
public class FileBytesStore implements BytesStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path file;

    public FileBytesStore(Path file) {
        this.file = file;
    }

    @Override
    public void save(byte[] content) {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
            Files.write(temp, content);
            moveIntoPlace(temp);
            log.debug("Wrote {} bytes to {}", content.length, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    @Override
    public Optional<byte[]> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
