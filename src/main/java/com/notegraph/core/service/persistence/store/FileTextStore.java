package com.notegraph.core.service.persistence.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * UTF-8 TextStore on top of a {@link FileBytesStore}.
 */
public class FileTextStore implements TextStore {

    private final FileBytesStore delegate;

    public FileTextStore(Path file) {
        this.delegate = new FileBytesStore(file);
    }

    @Override
    public void save(String content) {
        delegate.save(content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<String> load() {
        return delegate.load().map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public Path getFile() {
        return delegate.getFile();
    }
}
