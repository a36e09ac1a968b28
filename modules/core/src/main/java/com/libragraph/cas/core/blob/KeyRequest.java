package com.libragraph.cas.core.blob;

import com.libragraph.cas.util.ContentHash;

import java.util.Objects;

/**
 * Input to {@link KeyDerivation}: metadata only for a temporary key,
 * metadata plus content hash and size for the final key.
 */
public record KeyRequest(ContentHash hash, Long size, BlobMetadata meta) {

    public KeyRequest {
        Objects.requireNonNull(meta, "meta cannot be null");
    }

    public static KeyRequest temporary(BlobMetadata meta) {
        return new KeyRequest(null, null, meta);
    }

    public static KeyRequest content(ContentHash hash, long size, BlobMetadata meta) {
        return new KeyRequest(Objects.requireNonNull(hash, "hash cannot be null"), size, meta);
    }

    public boolean isTemporary() {
        return hash == null;
    }
}
