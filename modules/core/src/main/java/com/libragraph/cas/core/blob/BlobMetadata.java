package com.libragraph.cas.core.blob;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied attributes carried alongside a put.
 * Opaque to storage; only {@link KeyDerivation} looks at it.
 */
public record BlobMetadata(Map<String, String> values) {

    public static final String EXTENSION = "ext";

    private static final BlobMetadata EMPTY = new BlobMetadata(Map.of());

    public BlobMetadata {
        Objects.requireNonNull(values, "values cannot be null");
        values = Map.copyOf(values);
    }

    public static BlobMetadata empty() {
        return EMPTY;
    }

    public static BlobMetadata of(Map<String, String> values) {
        return new BlobMetadata(values);
    }

    /**
     * Metadata holding only a file extension, e.g. {@code ".txt"}.
     */
    public static BlobMetadata ofExtension(String extension) {
        return new BlobMetadata(Map.of(EXTENSION, extension));
    }

    /**
     * Metadata for a file name: its extension (including the dot) if it has one.
     */
    public static BlobMetadata ofFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot <= slash + 1) {
            return EMPTY;
        }
        return ofExtension(fileName.substring(dot));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<String> extension() {
        return get(EXTENSION);
    }

    public BlobMetadata with(String name, String value) {
        Map<String, String> copy = new HashMap<>(values);
        copy.put(name, value);
        return new BlobMetadata(copy);
    }
}
