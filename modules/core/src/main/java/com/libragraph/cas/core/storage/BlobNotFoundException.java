package com.libragraph.cas.core.storage;

/**
 * Thrown when a read, rename or delete targets a key that does not exist.
 * The message starts with {@value #CODE}.
 */
public class BlobNotFoundException extends StorageException {

    public static final String CODE = "ENOENT";

    private final String key;

    public BlobNotFoundException(String key) {
        super(CODE + ": blob not found: " + key);
        this.key = key;
    }

    public BlobNotFoundException(String key, Throwable cause) {
        super(CODE + ": blob not found: " + key, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
