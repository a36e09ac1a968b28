package com.libragraph.cas.core.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.util.Map;

/**
 * Key/value blob storage contract every backend satisfies.
 *
 * <p>Keys are opaque strings, unique per store. Every operation is lazy: nothing
 * happens until the returned {@link Uni} or {@link Multi} is subscribed.
 *
 * <p>Blob content travels as a stream of {@code byte[]} chunks. Chunks are
 * treated as immutable once emitted.
 */
public interface Store {

    /**
     * Persists every byte of {@code source} under {@code key}, replacing any existing entry.
     * Completes once the data is durable.
     *
     * <p>If {@code source} fails, the write fails with that same exception and
     * nothing becomes readable under {@code key}.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> write(String key, Multi<byte[]> source);

    /**
     * Streams the stored bytes to the subscriber.
     *
     * @throws BlobNotFoundException if the key is absent
     * @throws StorageException on I/O errors
     */
    Multi<byte[]> read(String key);

    /**
     * Relocates an entry, replacing {@code destKey} if present.
     *
     * @throws BlobNotFoundException if {@code sourceKey} is absent
     * @throws StorageException on I/O errors
     */
    Uni<Void> rename(String sourceKey, String destKey);

    /**
     * Checks whether a key exists. An absent key yields {@code false}, never a failure.
     */
    Uni<Boolean> exists(String key);

    /**
     * Removes an entry. Behavior for an absent key is backend-defined.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(String key);

    /**
     * Named extension operations offered by this backend.
     * Must return the same set for the lifetime of the store.
     */
    default Map<String, StoreCapability> capabilities() {
        return Map.of();
    }

    default boolean supports(String capability) {
        return capabilities().containsKey(capability);
    }

    /**
     * Invokes an extension capability by name.
     *
     * @throws CapabilityNotFoundException if the store does not offer it
     */
    default Uni<Object> invoke(String capability, Object... args) {
        StoreCapability target = capabilities().get(capability);
        if (target == null) {
            return Uni.createFrom().failure(new CapabilityNotFoundException(capability, this));
        }
        return Uni.createFrom().deferred(() -> target.invoke(args));
    }
}
