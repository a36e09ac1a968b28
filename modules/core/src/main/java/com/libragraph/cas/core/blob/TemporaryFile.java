package com.libragraph.cas.core.blob;

import com.libragraph.cas.core.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A local copy of a blob that is deleted on {@link #close()}.
 * Use with try-with-resources, or prefer {@link ContentAddressedStore#withTemporaryFile}.
 */
public final class TemporaryFile implements AutoCloseable {

    private final Path path;

    TemporaryFile(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /**
     * Deletes the file. Idempotent.
     *
     * @throws StorageException if the file exists but cannot be deleted
     */
    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Failed to delete temporary file: " + path, e);
        }
    }
}
