package com.libragraph.cas.core.blob;

import com.libragraph.cas.util.ContentHash;

import java.util.Objects;

/**
 * Record of a stored blob as returned by prepare and put.
 *
 * <p>{@code hash} and {@code size} are null until the content has streamed through;
 * after {@link ContentAddressedStore#finalizePut} they are always set and
 * {@code key} is derived from the hash.
 */
public record BlobInfo(String key, ContentHash hash, Long size, BlobMetadata meta, boolean finalized) {

    public BlobInfo {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(meta, "meta cannot be null");
        if (finalized && (hash == null || size == null)) {
            throw new IllegalArgumentException("A finalized blob must have hash and size: " + key);
        }
    }

    static BlobInfo prepared(String temporaryKey, ContentHash hash, long size, BlobMetadata meta) {
        return new BlobInfo(temporaryKey, hash, size, meta, false);
    }

    BlobInfo finalizedAs(String finalKey) {
        return new BlobInfo(finalKey, hash, size, meta, true);
    }

    public boolean hasHash() {
        return hash != null;
    }
}
