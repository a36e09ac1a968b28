package com.libragraph.cas.core.blob;

import java.nio.file.Path;

/**
 * Where and how {@link ContentAddressedStore#getTemporaryFile} creates its file.
 *
 * @param directory parent directory, or null for the system temp directory
 * @param prefix    file name prefix
 * @param suffix    file name suffix, or null to use the blob's metadata extension
 */
public record TemporaryFileOptions(Path directory, String prefix, String suffix) {

    public static TemporaryFileOptions defaults() {
        return new TemporaryFileOptions(null, "cas-", null);
    }

    public TemporaryFileOptions withDirectory(Path directory) {
        return new TemporaryFileOptions(directory, prefix, suffix);
    }

    public TemporaryFileOptions withSuffix(String suffix) {
        return new TemporaryFileOptions(directory, prefix, suffix);
    }
}
